package com.trade.sentinel.common.exception;

import lombok.Getter;

/**
 * Invalid control-plane configuration. Raised while beans are built, so it stops startup.
 */
@Getter
public class ConfigurationException extends BaseSentinelException {
    public static final String DEFAULT_ERROR_CODE = "ERR-CFG-001";

    private final String configKey;

    public ConfigurationException(String configKey, String message) {
        super(configKey + ": " + message);
        this.configKey = configKey;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
