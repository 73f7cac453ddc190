package de.t14d3.folio.exceptions;

/**
 * Raised when a class cannot be described as a document or embedded document.
 */
public class MappingException extends FolioException {
    public MappingException(String message) {
        super(message);
    }

    public MappingException(String message, Throwable cause) {
        super(message, cause);
    }

    public static MappingException notADocument(Class<?> type) {
        return new MappingException("Class " + type.getName() + " is not a valid document or embedded document");
    }

    public static MappingException identifierRequired(Class<?> type) {
        return new MappingException("No identifier specified for document " + type.getName()
                + ". Every document must have a field annotated with @Id");
    }

    public static MappingException duplicateFieldMapping(Class<?> type, String fieldName) {
        return new MappingException("Field '" + fieldName + "' in " + type.getName()
                + " was already declared, but it must be declared only once");
    }

    public static MappingException mappingNotFound(Class<?> type, String fieldName) {
        return new MappingException("No mapping found for field '" + fieldName + "' in " + type.getName());
    }
}
