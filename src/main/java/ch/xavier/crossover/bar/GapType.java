package ch.xavier.crossover.bar;

public enum GapType {
    SMALL,
    MEDIUM,
    WEEKEND,
    EXTREME;

    public static GapType classify(long gapMinutes) {
        if (gapMinutes < 60) {
            return SMALL;
        } else if (gapMinutes < 480) {
            return MEDIUM;
        } else if (gapMinutes < 2880) {
            return WEEKEND;
        }
        return EXTREME;
    }
}
