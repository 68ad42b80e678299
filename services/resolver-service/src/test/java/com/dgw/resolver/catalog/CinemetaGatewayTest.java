package com.dgw.resolver.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.dgw.resolver.model.MediaKind;
import com.dgw.resolver.resilience.OutboundCallExecutor;
import com.dgw.resolver.resilience.RetryProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class CinemetaGatewayTest {
    private MockRestServiceServer server;
    private CinemetaGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        CinemetaProperties properties = new CinemetaProperties();
        properties.setBaseUrl("http://cinemeta.test");
        properties.setRetry(new RetryProperties(0, List.of(), 0L));
        gateway = new CinemetaGateway(restTemplate, new ObjectMapper(), properties,
            new OutboundCallExecutor(new SimpleMeterRegistry()));
    }

    @Test
    void seriesLookupUsesSeriesCatalogAndFirstMatch() {
        server.expect(requestTo("http://cinemeta.test/catalog/series/top/search=breaking%20bad.json"))
            .andRespond(withSuccess("{\"metas\":[{\"imdb_id\":\"tt0903747\"},{\"imdb_id\":\"tt1\"}]}",
                MediaType.APPLICATION_JSON));

        assertThat(gateway.findImdbId(MediaKind.SHOW, "breaking bad")).contains("tt0903747");
        server.verify();
    }

    @Test
    void fallsBackToIdField() {
        server.expect(requestTo("http://cinemeta.test/catalog/movie/top/search=dune.json"))
            .andRespond(withSuccess("{\"metas\":[{\"id\":\"tt1160419\"}]}", MediaType.APPLICATION_JSON));

        assertThat(gateway.findImdbId(MediaKind.MOVIE, "dune")).contains("tt1160419");
    }

    @Test
    void noMetasMeansNoMatch() {
        server.expect(requestTo("http://cinemeta.test/catalog/movie/top/search=nothing.json"))
            .andRespond(withSuccess("{\"metas\":[]}", MediaType.APPLICATION_JSON));

        assertThat(gateway.findImdbId(MediaKind.MOVIE, "nothing")).isEmpty();
    }

    @Test
    void slashInTitleStaysInsideSearchSegment() {
        server.expect(requestTo("http://cinemeta.test/catalog/movie/top/search=ac%2Fdc%20live.json"))
            .andRespond(withSuccess("{\"metas\":[{\"imdb_id\":\"tt0221012\"}]}", MediaType.APPLICATION_JSON));

        assertThat(gateway.findImdbId(MediaKind.MOVIE, "ac/dc live")).contains("tt0221012");
        server.verify();
    }
}
