package com.taskengine.core.model;

/**
 * Dispatch priority. Higher weight is claimed first.
 */
public enum TaskPriority {
    LOW(0),
    NORMAL(1),
    HIGH(2);

    private final int weight;

    TaskPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    public boolean isHigherThan(TaskPriority other) {
        return weight > other.weight;
    }

    public static TaskPriority fromWeight(int weight) {
        for (TaskPriority priority : values()) {
            if (priority.weight == weight) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority weight: " + weight);
    }
}
