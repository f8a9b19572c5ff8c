package com.geoengine.plugin.provider;

public enum DataSourceType {
    UNKNOWN,
    FILE,
    DATABASE,
    WEB_SERVICE,
    MEMORY
}
