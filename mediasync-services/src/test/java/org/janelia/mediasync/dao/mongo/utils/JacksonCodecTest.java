package org.janelia.mediasync.dao.mongo.utils;

import java.util.Date;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.bson.BsonDocument;
import org.bson.BsonDocumentReader;
import org.bson.BsonDocumentWriter;
import org.bson.codecs.Codec;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.EncoderContext;
import org.bson.codecs.configuration.CodecRegistry;
import org.janelia.mediasync.cdi.ObjectMapperFactory;
import org.janelia.mediasync.model.CacheEntry;
import org.janelia.mediasync.model.CatalogItem;
import org.janelia.mediasync.model.MediaKind;
import org.janelia.mediasync.model.ProviderRecord;
import org.janelia.mediasync.model.StorageBackendKind;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class JacksonCodecTest {

    private CodecRegistry codecRegistry;

    @Before
    public void setUp() {
        ObjectMapper mongoObjectMapper = ObjectMapperFactory.instance().newMongoCompatibleObjectMapper();
        codecRegistry = RegistryHelper.createCodecRegistry(mongoObjectMapper);
    }

    private <T> BsonDocument encode(Class<T> type, T value) {
        BsonDocument document = new BsonDocument();
        codecRegistry.get(type).encode(new BsonDocumentWriter(document), value, EncoderContext.builder().build());
        return document;
    }

    private <T> T decode(Class<T> type, BsonDocument document) {
        return codecRegistry.get(type).decode(new BsonDocumentReader(document), DecoderContext.builder().build());
    }

    @Test
    public void entitiesGetJacksonCodecs() {
        Codec<CatalogItem> codec = codecRegistry.get(CatalogItem.class);
        assertThat(codec, instanceOf(JacksonCodec.class));
        assertEquals(CatalogItem.class, codec.getEncoderClass());
    }

    @Test
    public void catalogItemIsStoredUnderItsId() {
        CatalogItem item = new CatalogItem();
        item.setId(4521987654321L);
        item.setProviderId(12L);
        item.setRemoteFileId("2024/05/a.jpg");
        item.setFileName("a.jpg");
        item.setSize(3_000_000_000L);
        item.setMediaKind(MediaKind.VIDEO);
        item.setFirstSeenDate(new Date(1700000000000L));

        BsonDocument document = encode(CatalogItem.class, item);
        assertEquals(4521987654321L, document.getNumber("_id").longValue());
        assertFalse(document.containsKey("id"));
        assertEquals("VIDEO", document.getString("mediaKind").getValue());
        assertEquals(1700000000000L, document.getNumber("firstSeenDate").longValue());
        assertFalse(document.containsKey("contentHash"));

        CatalogItem decoded = decode(CatalogItem.class, document);
        assertEquals(item.getId(), decoded.getId());
        assertEquals(Long.valueOf(12L), decoded.getProviderId());
        assertEquals("2024/05/a.jpg", decoded.getRemoteFileId());
        assertEquals(3_000_000_000L, decoded.getSize());
        assertEquals(MediaKind.VIDEO, decoded.getMediaKind());
        assertEquals(item.getFirstSeenDate(), decoded.getFirstSeenDate());
    }

    @Test
    public void providerKindIsStoredAsCode() {
        ProviderRecord providerRecord = new ProviderRecord();
        providerRecord.setId(7L);
        providerRecord.setKind(StorageBackendKind.REMOTE_PICKER);
        providerRecord.setName("Remote");
        providerRecord.setConfiguration("{\"clientId\": \"c\"}");

        BsonDocument document = encode(ProviderRecord.class, providerRecord);
        assertEquals(StorageBackendKind.REMOTE_PICKER.getCode(), document.getNumber("kindCode").intValue());
        assertTrue(document.getBoolean("enabled").getValue());

        ProviderRecord decoded = decode(ProviderRecord.class, document);
        assertEquals(StorageBackendKind.REMOTE_PICKER, decoded.getKind());
        assertEquals("{\"clientId\": \"c\"}", decoded.getConfiguration());
    }

    @Test
    public void cacheEntryIsKeyedByHash() {
        CacheEntry cacheEntry = new CacheEntry();
        cacheEntry.setHash("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
        cacheEntry.setSize(5);
        cacheEntry.setAccessCount(3);
        cacheEntry.setLastAccessedDate(new Date(1234L));

        BsonDocument document = encode(CacheEntry.class, cacheEntry);
        assertEquals(cacheEntry.getHash(), document.getString("_id").getValue());

        CacheEntry decoded = decode(CacheEntry.class, document);
        assertEquals(cacheEntry.getHash(), decoded.getId());
        assertEquals(3, decoded.getAccessCount());
        assertEquals(new Date(1234L), decoded.getLastAccessedDate());
    }
}
