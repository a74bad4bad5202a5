package senatesim.core;

public final class SimulationLogger {
  private static volatile boolean enabled = true;

  private SimulationLogger() {}

  public static void setEnabled(boolean on) {
    enabled = on;
  }

  public static void log(String line) {
    if (!enabled || line == null) return;
    System.out.println(line);
  }

  public static void log(String tag, String line) {
    log("[" + tag + "] " + line);
  }
}
