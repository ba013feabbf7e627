package com.gdin.affinity.storage;

import com.gdin.affinity.models.StudentRecord;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class StudentDataLoaderTest {

    private final StudentDataLoader loader = new StudentDataLoader();

    @Test
    public void testLoadFixtureFromClasspath() {
        Map<String, StudentRecord> records = loader.load("classpath:fixtures/student_data.json");

        assertEquals(6, records.size());
        StudentRecord alice = records.get("alice@uni.edu");
        assertNotNull(alice);
        assertEquals("Alice", alice.getFirstName());
        assertEquals(List.of("Art", "Baking", "Cooking"), alice.getInterests());
    }

    @Test
    public void testUnknownFieldsIgnoredAndKeysNormalized() throws Exception {
        String json = "{\"  Bob@X.edu \": {\"firstName\": \"Bob\", \"interests\": [\"Hiking\"], \"availability\": [\"Mon\"]},"
                + "\"bob@x.edu\": {\"firstName\": \"Bobby\", \"interests\": []}}";

        Map<String, StudentRecord> records = loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertEquals(1, records.size());
        assertEquals("Bob", records.get("bob@x.edu").getFirstName());
    }

    @Test
    public void testMissingFileFails() {
        assertThrows(IllegalArgumentException.class, () -> loader.load("no/such/student_data.json"));
        assertThrows(IllegalArgumentException.class, () -> loader.load(" "));
    }
}
