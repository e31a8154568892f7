package com.pushhub.notification.model;

/** Read-only view of a configured provider. */
public final class ProviderStatus {

    private final String  name;
    private final boolean enabled;
    private final int     priority;

    public ProviderStatus(final String name, final boolean enabled, final int priority) {
        this.name     = name;
        this.enabled  = enabled;
        this.priority = priority;
    }

    public String  getName()     { return name; }
    public boolean isEnabled()   { return enabled; }
    public int     getPriority() { return priority; }

    @Override
    public String toString() {
        return "ProviderStatus{name=" + name + ", enabled=" + enabled + ", priority=" + priority + "}";
    }
}
