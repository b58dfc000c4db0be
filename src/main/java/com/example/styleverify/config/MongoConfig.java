package com.example.styleverify.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;
import org.springframework.data.mongodb.core.convert.DbRefResolver;
import org.springframework.data.mongodb.core.convert.DefaultDbRefResolver;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;

/**
 * Binds the MongoDB database holding templates and verification results
 * to {@code styleverify.mongo.uri}.
 */
@Configuration
public class MongoConfig {

    /**
     * Stands in for dots in map keys. Mismatch field maps are keyed by property names coming
     * from the extractor, which may contain dots; MongoDB rejects those as field names.
     */
    public static final String MAP_KEY_DOT_REPLACEMENT = "\uFF0E";

    @Bean
    public MongoDatabaseFactory mongoDatabaseFactory(StyleVerifyProperties properties) {
        return new SimpleMongoClientDatabaseFactory(properties.mongo().uri());
    }

    @Bean
    public MappingMongoConverter mappingMongoConverter(MongoDatabaseFactory factory,
                                                       MongoMappingContext mappingContext,
                                                       MongoCustomConversions conversions) {
        return mappingMongoConverter(new DefaultDbRefResolver(factory), mappingContext, conversions);
    }

    static MappingMongoConverter mappingMongoConverter(DbRefResolver dbRefResolver,
                                                       MongoMappingContext mappingContext,
                                                       MongoCustomConversions conversions) {
        MappingMongoConverter converter = new MappingMongoConverter(dbRefResolver, mappingContext);
        converter.setCustomConversions(conversions);
        converter.setMapKeyDotReplacement(MAP_KEY_DOT_REPLACEMENT);
        return converter;
    }
}
