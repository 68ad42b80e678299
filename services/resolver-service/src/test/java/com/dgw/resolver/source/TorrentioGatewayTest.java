package com.dgw.resolver.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.dgw.resolver.model.MediaTarget;
import com.dgw.resolver.model.RawRelease;
import com.dgw.resolver.resilience.ExternalCallException;
import com.dgw.resolver.resilience.OutboundCallExecutor;
import com.dgw.resolver.resilience.RetryProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class TorrentioGatewayTest {
    private MockRestServiceServer server;
    private TorrentioGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        TorrentioProperties properties = new TorrentioProperties();
        properties.setBaseUrl("http://torrentio.test/");
        properties.setOptions("sort=qualitysize");
        properties.setRetry(new RetryProperties(1, List.of(503), 0L));
        gateway = new TorrentioGateway(restTemplate, new ObjectMapper(), properties,
            new OutboundCallExecutor(new SimpleMeterRegistry()));
    }

    @Test
    void movieSearchReadsStreams() {
        server.expect(requestTo("http://torrentio.test/sort=qualitysize/stream/movie/tt0133093.json"))
            .andExpect(method(GET))
            .andRespond(withSuccess("{\"streams\":["
                + "{\"title\":\"The.Matrix.1999.2160p\\n👤 12\",\"infoHash\":\"" + "a".repeat(40) + "\"},"
                + "{\"title\":\"The.Matrix.1999.1080p\",\"infoHash\":\"" + "b".repeat(40) + "\"}"
                + "]}", MediaType.APPLICATION_JSON));

        List<RawRelease> releases = gateway.search(MediaTarget.movie("tt0133093"));

        assertThat(releases).extracting(RawRelease::infoHash).containsExactly("a".repeat(40), "b".repeat(40));
        assertThat(releases.get(0).title()).startsWith("The.Matrix.1999.2160p\n");
        server.verify();
    }

    @Test
    void showPathUsesFirstSeasonAndEpisode() {
        assertThat(gateway.streamPath(MediaTarget.show("tt0903747", List.of(3, 2), 5)))
            .isEqualTo("/stream/series/tt0903747:2:5.json");
        assertThat(gateway.streamPath(MediaTarget.show("tt0903747", List.of(), null)))
            .isEqualTo("/stream/series/tt0903747:1:1.json");
    }

    @Test
    void missingStreamsYieldsNothing() {
        server.expect(requestTo("http://torrentio.test/sort=qualitysize/stream/movie/tt1.json"))
            .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThat(gateway.search(MediaTarget.movie("tt1"))).isEmpty();
    }

    @Test
    void retriesUnavailableThenFails() {
        server.expect(ExpectedCount.times(2), requestTo("http://torrentio.test/sort=qualitysize/stream/movie/tt1.json"))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> gateway.search(MediaTarget.movie("tt1")))
            .isInstanceOf(ExternalCallException.class);
        server.verify();
    }
}
