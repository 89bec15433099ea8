package io.movewire.spring;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.movewire.codec.WireCodecs;
import io.movewire.core.json.MoveWireJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the shared mapper and codecs.
 *
 * Properties:
 *  - movewire.json.fail-on-unknown-properties (default false)
 *  - movewire.json.indent-output (default false)
 */
@Configuration
public class MoveWireConfiguration {
    private static final Logger log = LoggerFactory.getLogger(MoveWireConfiguration.class);

    @Bean
    ObjectMapper moveWireObjectMapper(
            @Value("${movewire.json.fail-on-unknown-properties:false}") boolean failOnUnknownProperties,
            @Value("${movewire.json.indent-output:false}") boolean indentOutput) {
        var mapper = MoveWireJson.newObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, failOnUnknownProperties)
                .configure(SerializationFeature.INDENT_OUTPUT, indentOutput);
        log.info("MoveWire mapper: failOnUnknownProperties={}, indentOutput={}", failOnUnknownProperties, indentOutput);
        return mapper;
    }

    @Bean
    WireCodecs wireCodecs(ObjectMapper moveWireObjectMapper) {
        return new WireCodecs(moveWireObjectMapper);
    }
}
