package com.example.inkbatch.device;

public enum DisplayType {
    EINK,
    RETINA
}
