package com.eduhub.quota;

/**
 * Outcome of one conditional counter increment.
 */
public final class CounterUpdate {
    
    private final boolean applied;
    private final long value;
    
    private CounterUpdate(boolean applied, long value) {
        this.applied = applied;
        this.value = value;
    }
    
    public static CounterUpdate applied(long value) {
        return new CounterUpdate(true, value);
    }
    
    public static CounterUpdate refused(long value) {
        return new CounterUpdate(false, value);
    }
    
    /**
     * @return true if the increment was recorded
     */
    public boolean isApplied() {
        return applied;
    }
    
    /**
     * @return the counter value after the increment, or the unchanged value when refused
     */
    public long getValue() {
        return value;
    }
    
    @Override
    public String toString() {
        return "CounterUpdate{applied=" + applied + ", value=" + value + '}';
    }
}
