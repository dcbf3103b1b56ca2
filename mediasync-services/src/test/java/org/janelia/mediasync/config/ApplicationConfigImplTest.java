package org.janelia.mediasync.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ApplicationConfigImplTest {

    private ApplicationConfigImpl applicationConfig;

    @Before
    public void setUp() {
        applicationConfig = new ApplicationConfigImpl();
        applicationConfig.putAll(ImmutableMap.<String, String>builder()
                .put("Storage.Root", "/data")
                .put("Storage.LocalPath", "${Storage.Root}/media")
                .put("ContentCache.Directory", "${Storage.Root}/cache/${Unknown.Key}")
                .put("ContentCache.MaxSizeBytes", " 1073741824 ")
                .put("Sync.MaxConcurrentProviders", "4")
                .put("MongoDB.createCollectionIndexes", "false")
                .put("Test.List", "a, b,,c ")
                .build());
    }

    @Test
    public void placeholdersAreResolved() {
        assertEquals("/data/media", applicationConfig.getStringPropertyValue("Storage.LocalPath"));
        assertEquals("/data/cache/${Unknown.Key}", applicationConfig.getStringPropertyValue("ContentCache.Directory"));
        assertEquals("/data/media", applicationConfig.asMap().get("Storage.LocalPath"));
    }

    @Test
    public void typedValues() {
        assertEquals(Long.valueOf(1073741824L), applicationConfig.getLongPropertyValue("ContentCache.MaxSizeBytes"));
        assertEquals(Integer.valueOf(4), applicationConfig.getIntegerPropertyValue("Sync.MaxConcurrentProviders", 1));
        assertFalse(applicationConfig.getBooleanPropertyValue("MongoDB.createCollectionIndexes", true));
        assertThat(applicationConfig.getStringListPropertyValue("Test.List"), contains("a", "b", "c"));
    }

    @Test
    public void defaultsForMissingValues() {
        assertNull(applicationConfig.getStringPropertyValue("Missing"));
        assertEquals("x", applicationConfig.getStringPropertyValue("Missing", "x"));
        assertNull(applicationConfig.getIntegerPropertyValue("Missing"));
        assertEquals(Integer.valueOf(10), applicationConfig.getIntegerPropertyValue("Missing", 10));
        assertEquals(Long.valueOf(5L), applicationConfig.getLongPropertyValue("Missing", 5L));
        assertTrue(applicationConfig.getBooleanPropertyValue("Missing", true));
        assertEquals(ImmutableList.of("d"), applicationConfig.getStringListPropertyValue("Missing", ImmutableList.of("d")));
    }
}
