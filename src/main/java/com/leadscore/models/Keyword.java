package com.leadscore.models;

import java.util.regex.Pattern;

public record Keyword(String text, Pattern pattern) {

    public boolean matches(String loweredTitle) {
        return pattern.matcher(loweredTitle).find();
    }
}
