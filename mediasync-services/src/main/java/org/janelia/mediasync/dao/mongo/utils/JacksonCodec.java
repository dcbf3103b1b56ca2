package org.janelia.mediasync.dao.mongo.utils;

import java.io.IOException;
import java.io.UncheckedIOException;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.bson.BsonReader;
import org.bson.BsonWriter;
import org.bson.Document;
import org.bson.codecs.Codec;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.EncoderContext;
import org.bson.codecs.configuration.CodecRegistry;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

/**
 * Maps an entity to and from BSON by going through its JSON representation.
 *
 * @param <T> entity type
 */
public class JacksonCodec<T> implements Codec<T> {

    private static final JsonWriterSettings JSON_SETTINGS = JsonWriterSettings.builder()
            .outputMode(JsonMode.RELAXED)
            .build();

    private final ObjectMapper objectMapper;
    private final Codec<Document> documentCodec;
    private final Class<T> type;

    JacksonCodec(ObjectMapper objectMapper, CodecRegistry codecRegistry, Class<T> type) {
        this.objectMapper = objectMapper;
        this.documentCodec = codecRegistry.get(Document.class);
        this.type = type;
    }

    @Override
    public T decode(BsonReader reader, DecoderContext decoderContext) {
        try {
            Document document = documentCodec.decode(reader, decoderContext);
            return objectMapper.readValue(document.toJson(JSON_SETTINGS), type);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void encode(BsonWriter writer, T value, EncoderContext encoderContext) {
        try {
            String json = objectMapper.writeValueAsString(value);
            documentCodec.encode(writer, Document.parse(json), encoderContext);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public Class<T> getEncoderClass() {
        return type;
    }
}
