package com.eh.digitalpathology.dicomrelay.api;

import com.eh.digitalpathology.dicomrelay.exceptions.DicomWebException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrthancRestClientTest {

    private MockWebServer mockWebServer;
    private OrthancRestClient orthancRestClient;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        WebClient webClient = WebClient.builder().baseUrl(mockWebServer.url("/").toString()).build();
        orthancRestClient = new OrthancRestClient(webClient);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private static MockResponse json(int code, String body) {
        return new MockResponse()
                .setResponseCode(code)
                .setHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .setBody(body);
    }

    @Test
    void listStudyIds_ShouldReturnIds() throws Exception {
        mockWebServer.enqueue(json(200, "[\"abc\",\"def\"]"));

        StepVerifier.create(orthancRestClient.listStudyIds())
                .assertNext(ids -> assertEquals(List.of("abc", "def"), ids))
                .verifyComplete();

        RecordedRequest request = mockWebServer.takeRequest();
        assertEquals("/studies", request.getPath());
    }

    @Test
    void listStudyIds_EmptyBody_ShouldReturnEmptyList() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200));

        StepVerifier.create(orthancRestClient.listStudyIds())
                .assertNext(ids -> assertTrue(ids.isEmpty()))
                .verifyComplete();
    }

    @Test
    void listStudyIds_ServerError_ShouldMapToDicomWebException() {
        mockWebServer.enqueue(json(500, "{\"error\":\"boom\"}"));

        StepVerifier.create(orthancRestClient.listStudyIds())
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(DicomWebException.class, e);
                    assertEquals(500, ((DicomWebException) e).getStatusCode());
                })
                .verify();
    }

    @Test
    void listStudyIds_Unreachable_ShouldMapToDicomWebException() throws IOException {
        mockWebServer.shutdown();

        StepVerifier.create(orthancRestClient.listStudyIds())
                .expectError(DicomWebException.class)
                .verify();
    }

    @Test
    void findStudyInstanceUid_ShouldReadMainDicomTags() throws Exception {
        mockWebServer.enqueue(json(200, "{\"ID\":\"abc\",\"MainDicomTags\":{\"StudyInstanceUID\":\"1.2.3\"}}"));

        StepVerifier.create(orthancRestClient.findStudyInstanceUid("abc"))
                .expectNext("1.2.3")
                .verifyComplete();

        assertEquals("/studies/abc", mockWebServer.takeRequest().getPath());
    }

    @Test
    void findStudyInstanceUid_MissingTag_ShouldCompleteEmpty() {
        mockWebServer.enqueue(json(200, "{\"ID\":\"abc\",\"MainDicomTags\":{}}"));

        StepVerifier.create(orthancRestClient.findStudyInstanceUid("abc"))
                .verifyComplete();
    }

    @Test
    void findStudyInstanceUid_NotFound_ShouldMapToDicomWebException() {
        mockWebServer.enqueue(json(404, "{}"));

        StepVerifier.create(orthancRestClient.findStudyInstanceUid("gone"))
                .expectErrorSatisfies(e -> assertEquals(404, ((DicomWebException) e).getStatusCode()))
                .verify();
    }
}
