package cobol.mapper.analysis;

public record Token(
        Kind kind,
        String text,   // words upper-cased, literals with their quotes
        int sequence   // sequence number of the record the token starts on
) {
    public enum Kind {
        WORD,
        LITERAL,
        LPAREN,
        RPAREN,
        PERIOD
    }

    public boolean isWord() {
        return kind == Kind.WORD;
    }

    public boolean isWord(String word) {
        return kind == Kind.WORD && text.equals(word);
    }
}
