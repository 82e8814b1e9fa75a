package com.napkin.engine.controllers;

import com.napkin.engine.NapkinApplication;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = NapkinApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class GridControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    private long createGrid(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<Long> response =
                restTemplate.postForEntity(url("/grid"), new HttpEntity<>(body, headers), Long.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        return response.getBody();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> putCell(long gridId, String label, String input) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        ResponseEntity<Map> response = restTemplate.exchange(url("/grid/" + gridId + "/cell/" + label),
                HttpMethod.PUT, new HttpEntity<>(input, headers), Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return response.getBody();
    }

    /**
     * Creates a grid, sets a few cells and reads the recomputed values back.
     */
    @Test
    @SuppressWarnings("unchecked")
    void testSetCellsAndReadGrid() {
        long gridId = createGrid("{\"rows\": 5, \"columns\": 5}");

        putCell(gridId, "A1", "10");
        putCell(gridId, "A2", "2.5");
        Map<String, Object> b1 = putCell(gridId, "B1", "=SUM(A1:A2");
        assertEquals("=SUM(A1:A2)", b1.get("input"));
        assertEquals("12.5", b1.get("value"));
        assertEquals(Boolean.FALSE, b1.get("error"));

        // Changing A1 must refresh B1
        putCell(gridId, "A1", "20");
        ResponseEntity<Map> cell = restTemplate.getForEntity(url("/grid/" + gridId + "/cell/b1"), Map.class);
        assertEquals("22.5", cell.getBody().get("value"));

        ResponseEntity<Map> grid = restTemplate.getForEntity(url("/grid/" + gridId), Map.class);
        assertEquals(HttpStatus.OK, grid.getStatusCode());
        assertEquals(Arrays.asList("A1", "B1", "A2"), Arrays.asList(grid.getBody().keySet().toArray()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testBatchEditDependenciesAndCsv() {
        long gridId = createGrid("{}");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String body = "{\"C1\": \"=A1*B1\", \"A1\": \"3\", \"B1\": \"4\"}";
        ResponseEntity<Map> batch = restTemplate.exchange(url("/grid/" + gridId + "/cells"),
                HttpMethod.PUT, new HttpEntity<>(body, headers), Map.class);
        Map<String, Object> c1 = (Map<String, Object>) batch.getBody().get("C1");
        assertEquals("12", c1.get("value"));

        ResponseEntity<Map> deps = restTemplate.getForEntity(url("/grid/" + gridId + "/dependencies"), Map.class);
        assertEquals(Arrays.asList("A1", "B1"), deps.getBody().get("C1"));
        assertEquals(1, deps.getBody().size());

        ResponseEntity<String> csv = restTemplate.getForEntity(url("/grid/" + gridId + "/csv"), String.class);
        assertEquals("3,4,12", csv.getBody());

        ResponseEntity<Void> cleared = restTemplate.exchange(url("/grid/" + gridId + "/cells"),
                HttpMethod.DELETE, null, Void.class);
        assertEquals(HttpStatus.NO_CONTENT, cleared.getStatusCode());
        ResponseEntity<Map> grid = restTemplate.getForEntity(url("/grid/" + gridId), Map.class);
        assertTrue(grid.getBody().isEmpty());
    }

    /**
     * A cycle is reported through the cell's error flag, not as an HTTP failure.
     */
    @Test
    void testCycleShowsAsErrorCells() {
        long gridId = createGrid("{\"rows\": 3, \"columns\": 3}");
        putCell(gridId, "A1", "=B1");
        Map<String, Object> b1 = putCell(gridId, "B1", "=A1");
        assertEquals("#ERROR", b1.get("value"));
        assertEquals(Boolean.TRUE, b1.get("error"));
    }

    @Test
    void testErrorResponses() {
        HttpClientErrorException notFound = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForEntity(url("/grid/999999"), Map.class));
        assertEquals(HttpStatus.NOT_FOUND, notFound.getStatusCode());
        assertTrue(notFound.getResponseBodyAsString().contains("GRID_NOT_FOUND"));

        // test profile caps grids at 50x26
        HttpClientErrorException tooBig = assertThrows(HttpClientErrorException.class,
                () -> createGrid("{\"rows\": 51}"));
        assertEquals(HttpStatus.BAD_REQUEST, tooBig.getStatusCode());
        assertTrue(tooBig.getResponseBodyAsString().contains("INVALID_DIMENSIONS"));

        long gridId = createGrid("{\"rows\": 2, \"columns\": 2}");
        HttpClientErrorException outside = assertThrows(HttpClientErrorException.class,
                () -> putCell(gridId, "C1", "1"));
        assertEquals(HttpStatus.BAD_REQUEST, outside.getStatusCode());
        assertTrue(outside.getResponseBodyAsString().contains("CELL_OUT_OF_BOUNDS"));

        HttpClientErrorException badLabel = assertThrows(HttpClientErrorException.class,
                () -> putCell(gridId, "A0", "1"));
        assertTrue(badLabel.getResponseBodyAsString().contains("INVALID_REFERENCE"));
    }

    @Test
    void testEvaluateFormula() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        String body = "{\"formula\": \"=ROUND(A1;2)*2\", \"cells\": {\"A1\": \"3.14159\"}}";
        ResponseEntity<Map> ok = restTemplate.postForEntity(url("/formula/evaluate"),
                new HttpEntity<>(body, headers), Map.class);
        assertEquals(Collections.singletonMap("value", "6.28"), ok.getBody());

        String divide = "{\"formula\": \"1/(A1-A1)\"}";
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.postForEntity(url("/formula/evaluate"),
                        new HttpEntity<>(divide, headers), Map.class));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("DIVISION_BY_ZERO"));

        HttpClientErrorException malformed = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.postForEntity(url("/formula/evaluate"),
                        new HttpEntity<>("{not json", headers), Map.class));
        assertTrue(malformed.getResponseBodyAsString().contains("MALFORMED_REQUEST"));
    }

    @Test
    void testDependencyListIsEmptyForPlainGrid() {
        long gridId = createGrid("{}");
        putCell(gridId, "A1", "hello");
        ResponseEntity<Map> deps = restTemplate.getForEntity(url("/grid/" + gridId + "/dependencies"), Map.class);
        assertEquals(Collections.emptyMap(), deps.getBody());
    }
}
