package com.authmap.core.store;

public class RoleNotFoundException extends MappingNotFoundException {

    public RoleNotFoundException() {
        super("Role not found in mapping store");
    }
}
