package com.weather.datalogger.exception;

import com.weather.datalogger.model.DataSource;

/**
 * 聚合失败。cause 保留原始的连接池或存储异常，source 标明失败发生的路径。
 *
 * 与"窗口内无数据"严格区分：后者是正常的空结果，不抛异常。
 */
public class AggregationException extends DataLoggerException {

    private final DataSource source;

    public AggregationException(DataSource source, Throwable cause) {
        super("Aggregation failed on " + source.name().toLowerCase() + " path: " + cause.getMessage(), cause);
        this.source = source;
    }

    public DataSource getSource() {
        return source;
    }
}
