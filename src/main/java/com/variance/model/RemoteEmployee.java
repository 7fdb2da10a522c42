package com.variance.model;

import java.util.Objects;

/**
 * Employee working from another country.
 */
public class RemoteEmployee extends Employee {

    private String location;  // e.g., "Canada"

    public RemoteEmployee() {
        // For Jackson
    }

    public RemoteEmployee(String name, String location) {
        super(name);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        RemoteEmployee that = (RemoteEmployee) o;
        return Objects.equals(location, that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), location);
    }

    @Override
    public String toString() {
        return "RemoteEmployee[name=" + getName() + ", location=" + location + "]";
    }
}
