package fractal.compute.model;

/**
 * Task priority. Higher priorities are claimed first.
 */
public enum TaskPriority {
    LOW(0),
    NORMAL(1),
    HIGH(2);

    private final int value;

    TaskPriority(int value) {
        this.value = value;
    }

    /** Value stored in the database (ordered) */
    public int value() {
        return value;
    }

    public static TaskPriority fromValue(int value) {
        for (TaskPriority p : values()) {
            if (p.value == value) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown priority value: " + value);
    }
}
