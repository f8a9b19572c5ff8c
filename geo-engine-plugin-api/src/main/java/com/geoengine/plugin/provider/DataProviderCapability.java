package com.geoengine.plugin.provider;

public enum DataProviderCapability {
    READ,
    WRITE,
    CREATE,
    DELETE,
    SPATIAL_INDEX,
    ATTRIBUTE_INDEX,
    TRANSACTION,
    BULK_INSERT
}
