package com.cascade.model;

/**
 * Assigned-user composite value of identity fields such as System.AssignedTo.
 * Its string form is the unique name, which is also what gets written back.
 */
public record IdentityRef(String displayName, String uniqueName) {

    @Override
    public String toString() {
        return uniqueName;
    }
}
