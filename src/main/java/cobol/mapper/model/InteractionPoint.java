package cobol.mapper.model;

public record InteractionPoint(
        String paragraph,
        InteractionKind kind,
        String target,   // program, transaction or map name; null when not given
        String mapset,   // SEND/RECEIVE MAP only
        int sequence
) {
}
