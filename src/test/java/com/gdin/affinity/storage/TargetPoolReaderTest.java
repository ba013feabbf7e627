package com.gdin.affinity.storage;

import com.gdin.affinity.models.TargetMember;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TargetPoolReaderTest {

    private final TargetPoolReader reader = new TargetPoolReader();

    @Test
    public void testReadFixture() {
        List<TargetMember> members = reader.read("classpath:fixtures/micro-community-pool.csv", "Email", "Track");

        assertEquals(7, members.size());
        assertEquals("alice@uni.edu", members.get(0).getIdentifier());
        assertEquals("Design", members.get(0).getGroup());
        assertEquals("frank@uni.edu", members.get(5).getIdentifier());
    }

    @Test
    public void testBomAndBlankRowsAreHandled() {
        String csv = "\uFEFFEmail,Track\nA@x.edu,T1\n\n ,T2\nb@x.edu, T2 \n";

        List<TargetMember> members = reader.readFromString(csv, "Email", "Track");

        assertEquals(2, members.size());
        assertEquals("a@x.edu", members.get(0).getIdentifier());
        assertEquals("T2", members.get(1).getGroup());
    }

    @Test
    public void testMissingColumnFails() {
        assertThrows(IllegalStateException.class, () -> reader.readFromString("Mail,Track\na@x.edu,T1\n", "Email", "Track"));
    }
}
