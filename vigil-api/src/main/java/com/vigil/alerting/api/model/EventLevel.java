/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api.model;

/**
 * Log level carried by an incoming event.
 */
public enum EventLevel {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
