package com.scholary.spatialaudio.spatial;

/**
 * A timed move of the sound source from one word's position to the next.
 *
 * @param start start time in seconds
 * @param end end time in seconds, always greater than {@code start}
 * @param effect the move, in both angle unit systems
 * @param metadata the word this effect belongs to
 */
public record AmbisonicEffect(double start, double end, Move effect, Metadata metadata) {

  public record Move(
      String type, PositionRad fromRad, PositionRad toRad, PositionPi fromPi, PositionPi toPi) {

    static Move between(Position from, Position to) {
      return new Move(
          "move", from.positionRad(), to.positionRad(), from.positionPi(), to.positionPi());
    }
  }

  public record Metadata(int index, String word, double confidence, String method) {}
}
