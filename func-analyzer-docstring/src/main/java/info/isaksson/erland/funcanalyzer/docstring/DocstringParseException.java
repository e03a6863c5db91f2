package info.isaksson.erland.funcanalyzer.docstring;

/** A docstring does not follow the convention a structured parser expected. */
public class DocstringParseException extends Exception {

    public DocstringParseException(String message) {
        super(message);
    }
}
