package cobol.mapper.model;

/**
 * Contacts with the outside world that do not leave the program.
 */
public enum InteractionKind {
    LINK,
    START,
    SEND_MAP,
    RECEIVE_MAP,
    CALL
}
