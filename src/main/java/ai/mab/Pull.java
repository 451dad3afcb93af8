package ai.mab;

/** One recorded round: the arm that was pulled and the reward it paid. */
public record Pull(int arm, double reward) {
}
