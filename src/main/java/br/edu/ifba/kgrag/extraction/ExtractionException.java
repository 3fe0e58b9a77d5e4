package br.edu.ifba.kgrag.extraction;

/**
 * The LLM answered, but with nothing a graph can be built from.
 * Never retried: asking again with the same prompt is not expected to help.
 */
public class ExtractionException extends RuntimeException {

    private final String sectionId;

    public ExtractionException(String message, String sectionId) {
        super(message);
        this.sectionId = sectionId;
    }

    public String getSectionId() {
        return sectionId;
    }
}
