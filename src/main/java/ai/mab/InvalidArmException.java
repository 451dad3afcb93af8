package ai.mab;

/**
 * Thrown when an arm index falls outside {@code [0, armCount)}. Arm indices are
 * never clamped.
 */
public class InvalidArmException extends IllegalArgumentException {
  private static final long serialVersionUID = 5077123093612294117L;

  public final int arm, armCount;

  public InvalidArmException(final int arm, final int armCount) {
    super(String.format("Arm %d is outside [0, %d).", arm, armCount));
    this.arm = arm;
    this.armCount = armCount;
  }

  public static int check(final int arm, final int armCount) {
    if (arm < 0 || arm >= armCount) {
      throw new InvalidArmException(arm, armCount);
    }
    return arm;
  }
}
