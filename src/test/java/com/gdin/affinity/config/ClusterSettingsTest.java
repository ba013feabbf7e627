package com.gdin.affinity.config;

import com.gdin.affinity.config.properties.AffinityProperties;
import com.gdin.affinity.exception.InvalidClusterConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ClusterSettingsTest {

    @Test
    public void testDefaultsAreValid() {
        ClusterSettings settings = ClusterSettings.defaults().validate();
        assertEquals(1.0, settings.getResolution());
        assertEquals(5, settings.getTopN());
        assertNull(settings.getSeed());
    }

    @Test
    public void testFromPropertiesCopiesExcludedInterests() {
        AffinityProperties properties = new AffinityProperties();
        properties.getCluster().setResolution(1.5);
        properties.getCluster().setSeed(42);
        properties.getSummary().setTopN(3);

        ClusterSettings settings = ClusterSettings.from(properties).validate();

        assertEquals(1.5, settings.getResolution());
        assertEquals(42, settings.getSeed());
        assertEquals(3, settings.getTopN());
        assertEquals(
                Set.of("AI & machine learning", "something not listed", "still figuring it out"),
                settings.getExcludedInterests()
        );
    }

    @Test
    public void testInvalidValuesAreRejected() {
        ClusterSettings base = ClusterSettings.defaults();

        assertThrows(InvalidClusterConfigurationException.class, () -> base.toBuilder().resolution(0).build().validate());
        assertThrows(InvalidClusterConfigurationException.class, () -> base.toBuilder().resolution(-1).build().validate());
        assertThrows(InvalidClusterConfigurationException.class, () -> base.toBuilder().resolution(Double.NaN).build().validate());
        assertThrows(InvalidClusterConfigurationException.class, () -> base.toBuilder().topN(-1).build().validate());
        assertThrows(InvalidClusterConfigurationException.class, () -> base.toBuilder().maxLevels(0).build().validate());
        assertThrows(InvalidClusterConfigurationException.class, () -> base.toBuilder().maxPasses(0).build().validate());
        assertThrows(InvalidClusterConfigurationException.class, () -> base.toBuilder().identifierDelimiter(null).build().validate());
    }

    @Test
    public void testTopNZeroIsAllowed() {
        assertEquals(0, ClusterSettings.defaults().toBuilder().topN(0).build().validate().getTopN());
    }
}
