package com.authmap.core.store;

public class UserNotFoundException extends MappingNotFoundException {

    public UserNotFoundException() {
        super("User not found in mapping store");
    }
}
