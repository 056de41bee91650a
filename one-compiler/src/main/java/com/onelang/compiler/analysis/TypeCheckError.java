package com.onelang.compiler.analysis;

import com.onelang.compiler.lexer.SourceLocation;

import java.util.Objects;

/**
 * 类型检查诊断条目
 */
public final class TypeCheckError {

    private final String message;
    private final SourceLocation location;

    public TypeCheckError(String message, SourceLocation location) {
        this.message = message;
        this.location = location;
    }

    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeCheckError)) return false;
        TypeCheckError that = (TypeCheckError) o;
        return message.equals(that.message) && Objects.equals(location, that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, location);
    }

    @Override
    public String toString() {
        return location + ": " + message;
    }
}
