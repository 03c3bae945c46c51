package com.eainde.monitor.search.eap;

import java.util.regex.Pattern;

public final class Validators {

    private static final Pattern SPAN_ID = Pattern.compile("^[0-9a-fA-F]{16}$");
    private static final Pattern EVENT_ID = Pattern.compile(
            "^[0-9a-fA-F]{8}-?[0-9a-fA-F]{4}-?[0-9a-fA-F]{4}-?[0-9a-fA-F]{4}-?[0-9a-fA-F]{12}$");

    private Validators() {
    }

    public static boolean isSpanId(Object value) {
        return value instanceof String s && SPAN_ID.matcher(s).matches();
    }

    public static boolean isEventId(Object value) {
        return value instanceof String s && EVENT_ID.matcher(s).matches();
    }
}
