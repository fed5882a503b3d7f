package cn.pianzi.holdem.core.snapshot;

/**
 * Finish position of one seat. {@code eliminatedInHand} is 0 for players still alive, whose
 * {@code stack} also counts what they have in the pot of an open hand.
 */
public record Standing(int place, int seat, String name, int stack, int eliminatedInHand) {
}
