package edu.isi.kazakhfst;
/** for a rule or cascade that accepts no string at all. almost always a rule table authoring bug */
public class EmptyLanguageException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public EmptyLanguageException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public EmptyLanguageException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public EmptyLanguageException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public EmptyLanguageException(Throwable cause) { super(cause); }
}
