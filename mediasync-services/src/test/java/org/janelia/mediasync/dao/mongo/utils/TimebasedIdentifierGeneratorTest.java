package org.janelia.mediasync.dao.mongo.utils;

import java.util.HashSet;
import java.util.List;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.Assert.assertEquals;

public class TimebasedIdentifierGeneratorTest {

    @Test
    public void idsAreUniqueAndIncreasing() {
        TimebasedIdentifierGenerator idGenerator = new TimebasedIdentifierGenerator(3);
        List<Long> ids = idGenerator.generateIdList(50000);
        assertEquals(ids.size(), new HashSet<>(ids).size());
        for (int i = 1; i < ids.size(); i++) {
            assertThat(ids.get(i), greaterThan(ids.get(i - 1)));
        }
        assertThat(idGenerator.generateId(), greaterThan(ids.get(ids.size() - 1)));
    }

    @Test
    public void deploymentContextIsEncoded() {
        Long id = new TimebasedIdentifierGenerator(5).generateId();
        assertEquals(5L, (id >> 14) & 0xFF);
    }

    @Test(expected = IllegalArgumentException.class)
    public void deploymentContextOutOfRange() {
        new TimebasedIdentifierGenerator(256);
    }
}
