package org.janelia.mediasync.cdi;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.enterprise.inject.spi.InjectionPoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.janelia.mediasync.cdi.qualifier.ApplicationProperties;
import org.janelia.mediasync.cdi.qualifier.BoolPropertyValue;
import org.janelia.mediasync.cdi.qualifier.IntPropertyValue;
import org.janelia.mediasync.cdi.qualifier.LongPropertyValue;
import org.janelia.mediasync.cdi.qualifier.MediaSyncDefault;
import org.janelia.mediasync.cdi.qualifier.PropertyValue;
import org.janelia.mediasync.cdi.qualifier.StrPropertyValue;
import org.janelia.mediasync.config.ApplicationConfig;
import org.janelia.mediasync.dao.mongo.utils.TimebasedIdentifierGenerator;

@ApplicationScoped
public class ApplicationProducer {

    @Produces
    public ObjectMapper objectMapper(ObjectMapperFactory objectMapperFactory) {
        return objectMapperFactory.getDefaultObjectMapper();
    }

    @Produces
    public ObjectMapperFactory objectMapperFactory() {
        return ObjectMapperFactory.instance();
    }

    @MediaSyncDefault
    @ApplicationScoped
    @Produces
    public TimebasedIdentifierGenerator idGenerator(@IntPropertyValue(name = "TimebasedIdentifierGenerator.DeploymentContext") int deploymentContext) {
        return new TimebasedIdentifierGenerator(deploymentContext);
    }

    @PropertyValue(name = "")
    @Produces
    public String stringPropertyValue(@ApplicationProperties ApplicationConfig applicationConfig, InjectionPoint injectionPoint) {
        final PropertyValue property = injectionPoint.getAnnotated().getAnnotation(PropertyValue.class);
        return applicationConfig.getStringPropertyValue(property.name());
    }

    @PropertyValue(name = "")
    @Produces
    public Integer integerPropertyValue(@ApplicationProperties ApplicationConfig applicationConfig, InjectionPoint injectionPoint) {
        final PropertyValue property = injectionPoint.getAnnotated().getAnnotation(PropertyValue.class);
        return applicationConfig.getIntegerPropertyValue(property.name());
    }

    @IntPropertyValue(name = "")
    @Produces
    public int intPropertyValueWithDefault(@ApplicationProperties ApplicationConfig applicationConfig, InjectionPoint injectionPoint) {
        final IntPropertyValue property = injectionPoint.getAnnotated().getAnnotation(IntPropertyValue.class);
        return applicationConfig.getIntegerPropertyValue(property.name(), property.defaultValue());
    }

    @LongPropertyValue(name = "")
    @Produces
    public long longPropertyValueWithDefault(@ApplicationProperties ApplicationConfig applicationConfig, InjectionPoint injectionPoint) {
        final LongPropertyValue property = injectionPoint.getAnnotated().getAnnotation(LongPropertyValue.class);
        return applicationConfig.getLongPropertyValue(property.name(), property.defaultValue());
    }

    @StrPropertyValue(name = "")
    @Produces
    public String stringPropertyValueWithDefault(@ApplicationProperties ApplicationConfig applicationConfig, InjectionPoint injectionPoint) {
        final StrPropertyValue property = injectionPoint.getAnnotated().getAnnotation(StrPropertyValue.class);
        return applicationConfig.getStringPropertyValue(property.name(), property.defaultValue());
    }

    @BoolPropertyValue(name = "")
    @Produces
    public boolean booleanPropertyValueWithDefault(@ApplicationProperties ApplicationConfig applicationConfig, InjectionPoint injectionPoint) {
        final BoolPropertyValue property = injectionPoint.getAnnotated().getAnnotation(BoolPropertyValue.class);
        return applicationConfig.getBooleanPropertyValue(property.name(), property.defaultValue());
    }

    @ApplicationProperties
    @ApplicationScoped
    @Produces
    public ApplicationConfig applicationConfig() {
        return ApplicationConfigProvider.mediaSyncConfig();
    }
}
