package it.berlink.dbmonitor.orm;

public enum OrmLogLevel {
    INFO,
    WARN,
    ERROR
}
