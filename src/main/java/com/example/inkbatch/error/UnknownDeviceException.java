package com.example.inkbatch.error;

public class UnknownDeviceException extends ValidationException {
    private final String deviceKey;

    public UnknownDeviceException(String deviceKey) {
        super("Unknown device '" + deviceKey + "'.");
        this.deviceKey = deviceKey;
    }

    public String deviceKey() {
        return deviceKey;
    }
}
