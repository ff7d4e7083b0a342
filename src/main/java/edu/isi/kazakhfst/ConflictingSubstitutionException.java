package edu.isi.kazakhfst;
/** for substitution maps with an empty or repeated input */
public class ConflictingSubstitutionException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public ConflictingSubstitutionException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public ConflictingSubstitutionException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public ConflictingSubstitutionException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public ConflictingSubstitutionException(Throwable cause) { super(cause); }
}
