package org.janelia.mediasync.cdi;

import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import org.janelia.mediasync.cdi.qualifier.IntPropertyValue;
import org.janelia.mediasync.cdi.qualifier.StrPropertyValue;
import org.janelia.mediasync.dao.mongo.utils.RegistryHelper;
import org.slf4j.Logger;

@ApplicationScoped
public class PersistenceProducer {

    @Inject
    private Logger log;

    @ApplicationScoped
    @Produces
    public MongoClient createMongoClient(
            @StrPropertyValue(name = "MongoDB.ConnectionURL", defaultValue = "mongodb://localhost:27017") String mongoConnectionURL,
            @IntPropertyValue(name = "MongoDB.ConnectTimeout", defaultValue = 10000) int connectTimeout,
            @IntPropertyValue(name = "MongoDB.ConnectionsPerHost", defaultValue = 20) int connectionsPerHost,
            ObjectMapperFactory objectMapperFactory) {
        log.info("Connecting to {}", mongoConnectionURL);
        MongoClientSettings mongoClientSettings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(mongoConnectionURL))
                .codecRegistry(RegistryHelper.createCodecRegistry(objectMapperFactory.newMongoCompatibleObjectMapper()))
                .applyToSocketSettings(builder -> builder.connectTimeout(connectTimeout, TimeUnit.MILLISECONDS))
                .applyToConnectionPoolSettings(builder -> builder.maxSize(connectionsPerHost))
                .build();
        return MongoClients.create(mongoClientSettings);
    }

    public void closeMongoClient(@Disposes MongoClient mongoClient) {
        log.info("Closing mongo client");
        mongoClient.close();
    }

    @ApplicationScoped
    @Produces
    public MongoDatabase createDefaultMongoDatabase(MongoClient mongoClient,
                                                    @StrPropertyValue(name = "MongoDB.Database", defaultValue = "mediasync") String mongoDatabase) {
        return mongoClient.getDatabase(mongoDatabase);
    }

}
