package com.variance.model;

public class Employee extends Person {

    public Employee() {
        // For Jackson
    }

    public Employee(String name) {
        super(name);
    }

    @Override
    public String toString() {
        return "Employee[name=" + getName() + "]";
    }
}
