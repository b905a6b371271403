package com.example.channeluploader;

public enum LogLevel {
    INFO,
    SUCCESS,
    WARNING,
    ERROR
}
