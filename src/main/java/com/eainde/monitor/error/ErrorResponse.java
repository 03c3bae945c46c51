package com.eainde.monitor.error;

public record ErrorResponse(String detail) {
}
