package senatesim.core;

public interface Node {
  String name();

  /** The phase the round is in once this node has run. */
  RoundPhase produces();

  void run(RoundState state);
}
