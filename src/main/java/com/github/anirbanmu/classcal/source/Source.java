package com.github.anirbanmu.classcal.source;

// a configured school: how to log in and fetch, and how to read what comes back
public record Source(String name, Portal portal, ScheduleAdapter adapter) {
}
