package com.variance.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the person hierarchy's identity and JSON shape.
 */
class PersonJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Id is the name")
    void idIsName() {
        assertEquals("Karen", new Employee("Karen").getId());
        assertEquals("Andrew", new RemoteEmployee("Andrew", "Canada").getId());
    }

    @Test
    @DisplayName("Equality requires the same concrete type")
    void equalityIsByTypeAndFields() {
        assertEquals(new Employee("Karen"), new Employee("Karen"));
        assertEquals(new RemoteEmployee("Karen", "Usa").hashCode(), new RemoteEmployee("Karen", "Usa").hashCode());
        assertNotEquals(new Employee("Karen"), new RemoteEmployee("Karen", "Usa"));
        assertNotEquals(new RemoteEmployee("Karen", "Usa"), new Employee("Karen"));
        assertNotEquals(new RemoteEmployee("Karen", "Usa"), new RemoteEmployee("Karen", "UK"));
    }

    @Test
    @DisplayName("JSON carries a type discriminator and no separate id field")
    void jsonShape() throws Exception {
        JsonNode node = mapper.readTree(mapper.writeValueAsString(new RemoteEmployee("Carol", "UK")));

        assertEquals("remote-employee", node.get("type").asText());
        assertEquals("Carol", node.get("name").asText());
        assertEquals("UK", node.get("location").asText());
        assertFalse(node.has("id"));
    }

    @Test
    @DisplayName("Reading through the base type restores the concrete subtype")
    void readsSubtypeThroughBase() throws Exception {
        Person person = mapper.readValue("{\"type\":\"remote-employee\",\"name\":\"Carol\",\"location\":\"UK\"}", Person.class);

        assertEquals(new RemoteEmployee("Carol", "UK"), person);
    }

    @Test
    @DisplayName("toString names the concrete type")
    void toStringShowsType() {
        assertEquals("Employee[name=Karen]", new Employee("Karen").toString());
        assertEquals("RemoteEmployee[name=Andrew, location=Canada]", new RemoteEmployee("Andrew", "Canada").toString());
    }
}
