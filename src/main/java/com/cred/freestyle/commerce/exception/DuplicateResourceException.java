package com.cred.freestyle.commerce.exception;

/**
 * Exception thrown when creating a resource would violate a uniqueness rule
 * (registered email, category name, coupon code, one review per product).
 *
 * @author Commerce Platform Team
 */
public class DuplicateResourceException extends RuntimeException {

    private final String resourceType;
    private final String field;
    private final String value;

    public DuplicateResourceException(String resourceType, String field, String value) {
        super(String.format("%s with %s '%s' already exists", resourceType, field, value));
        this.resourceType = resourceType;
        this.field = field;
        this.value = value;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getField() {
        return field;
    }

    public String getValue() {
        return value;
    }
}
