package ai.mab;

/** A completed simulation round, as published to live observers. */
public record Round(int index, int arm, double reward, double runningCtr) {
}
