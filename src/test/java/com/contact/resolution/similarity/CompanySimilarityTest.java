package com.contact.resolution.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class CompanySimilarityTest {

    private final CompanySimilarity similarity = new CompanySimilarity();

    @ParameterizedTest(name = "{0} vs {1} = {2}")
    @CsvSource({
            "Acme, Acme Corp, 1.0",
            "ACME CORP, acme, 1.0",
            "Acme, Globex, 0.0",
            "'', Acme, 0.0"
    })
    @DisplayName("Containment in either direction matches")
    void containment(String a, String b, double expected) {
        assertEquals(expected, similarity.compute(a, b));
    }

    @Test
    @DisplayName("Null company scores zero")
    void nullCompany() {
        assertEquals(0.0, similarity.compute(null, "Acme"));
    }
}
