package com.variance.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * A person keyed by name.
 *
 * Stored as JSON with a "type" discriminator so subtypes survive a round trip
 * through a store typed for a more general element.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Employee.class, name = "employee"),
    @JsonSubTypes.Type(value = RemoteEmployee.class, name = "remote-employee")
})
public abstract class Person implements Identifiable {

    private String name;

    protected Person() {
        // For Jackson
    }

    protected Person(String name) {
        this.name = name;
    }

    @Override
    @JsonIgnore
    public String getId() {
        return name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Person that = (Person) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), name);
    }
}
