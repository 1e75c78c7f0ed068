package com.sheetengine.app.controllers;

import com.sheetengine.app.SheetEngineApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = SheetEngineApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class WorkbookControllerIntegrationTest {

    @LocalServerPort
    int port;

    private RestTemplate restTemplate;
    private String documentUrl;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        ResponseEntity<Map> created = restTemplate.postForEntity(
                "http://localhost:" + port + "/documents", json("{\"title\": \"Quarterly\"}"), Map.class);
        assertEquals(HttpStatus.CREATED, created.getStatusCode());
        documentUrl = "http://localhost:" + port + "/documents/" + created.getBody().get("id");
    }

    private static HttpEntity<String> json(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private void put(String path, String body) {
        restTemplate.exchange(documentUrl + path, HttpMethod.PUT, json(body), String.class);
    }

    /**
     * Tests setting values and a formula, then reading computed values back.
     */
    @Test
    void testSetCellsAndReadValues() {
        put("/sheets/sheet1/cells/A1", "{\"value\": 10}");
        put("/sheets/sheet1/cells/A2", "{\"value\": 32}");

        ResponseEntity<Map> formula = restTemplate.exchange(documentUrl + "/sheets/sheet1/cells/A3",
                HttpMethod.PUT, json("{\"formula\": \"=SUM(A1:A2)\"}"), Map.class);
        assertEquals(HttpStatus.OK, formula.getStatusCode());
        assertEquals(42, formula.getBody().get("value"));
        assertEquals("=SUM(A1:A2)", formula.getBody().get("formula"));

        put("/sheets/sheet1/cells/A1", "{\"value\": 0}");

        Map values = restTemplate.getForObject(documentUrl + "/sheets/sheet1", Map.class);
        assertEquals(0, values.get("A1"));
        assertEquals(32, values.get("A3"));

        Map formulas = restTemplate.getForObject(documentUrl + "/sheets/sheet1/formulas", Map.class);
        assertEquals(Map.of("A3", "=SUM(A1:A2)"), formulas);

        Map reverse = restTemplate.getForObject(documentUrl + "/sheets/sheet1/reverseDependencies", Map.class);
        assertEquals(List.of("A3"), reverse.get("A1:A2"));
    }

    @Test
    void testRangeWriteAndStructuralEdit() {
        put("/sheets/sheet1/ranges/A1:B2",
                "{\"values\": [[1, 2], [3, null]], \"formulas\": [[null, null], [null, \"=A1+B1+A2\"]]}");

        restTemplate.postForEntity(documentUrl + "/sheets/sheet1/rows/insert?at=2&count=1", null, Void.class);

        Map formulas = restTemplate.getForObject(documentUrl + "/sheets/sheet1/formulas", Map.class);
        assertEquals("=A1+B1+A3", formulas.get("B3"));
        Map cell = restTemplate.getForObject(documentUrl + "/sheets/sheet1/cells/B3", Map.class);
        assertEquals(6, cell.get("value"));
    }

    @Test
    void testCircularReferenceIsAValueNotAnError() {
        put("/sheets/sheet1/cells/A1", "{\"formula\": \"=B1\"}");
        ResponseEntity<Map> response = restTemplate.exchange(documentUrl + "/sheets/sheet1/cells/B1",
                HttpMethod.PUT, json("{\"formula\": \"=A1\"}"), Map.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("#CIRC!", response.getBody().get("value"));
    }

    @Test
    void testNamedRangeAndRecalculate() {
        put("/sheets/sheet1/cells/A1", "{\"value\": 4}");
        put("/names/Inputs", "{\"sheetId\": \"sheet1\", \"range\": \"A1:A3\"}");
        put("/sheets/sheet1/cells/C1", "{\"formula\": \"=SUM(inputs)*2\"}");

        Map names = restTemplate.getForObject(documentUrl + "/names", Map.class);
        assertEquals("sheet1!A1:A3", names.get("Inputs"));

        ResponseEntity<Map> recalculated = restTemplate.postForEntity(documentUrl + "/recalculate", null, Map.class);
        assertEquals(HttpStatus.OK, recalculated.getStatusCode());
        Map cell = restTemplate.getForObject(documentUrl + "/sheets/sheet1/cells/C1", Map.class);
        assertEquals(8, cell.get("value"));
    }

    /**
     * Error mapping: unknown ids are 404, malformed input is 400, forbidden operations are 409.
     */
    @Test
    void testErrorResponses() {
        HttpClientErrorException missingDocument = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForObject("http://localhost:" + port + "/documents/nope", Map.class));
        assertEquals(HttpStatus.NOT_FOUND, missingDocument.getStatusCode());
        assertTrue(missingDocument.getResponseBodyAsString().contains("DOCUMENT_NOT_FOUND"));

        HttpClientErrorException missingSheet = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForObject(documentUrl + "/sheets/sheet9", Map.class));
        assertEquals(HttpStatus.NOT_FOUND, missingSheet.getStatusCode());

        HttpClientErrorException badAddress = assertThrows(HttpClientErrorException.class, () ->
                put("/sheets/sheet1/cells/1A", "{\"value\": 1}"));
        assertEquals(HttpStatus.BAD_REQUEST, badAddress.getStatusCode());
        assertTrue(badAddress.getResponseBodyAsString().contains("INVALID_REFERENCE"));

        HttpClientErrorException both = assertThrows(HttpClientErrorException.class, () ->
                put("/sheets/sheet1/cells/A1", "{\"value\": 1, \"formula\": \"=2\"}"));
        assertEquals(HttpStatus.BAD_REQUEST, both.getStatusCode());
        assertTrue(both.getResponseBodyAsString().contains("VALIDATION_FAILED"));

        HttpClientErrorException lastSheet = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.delete(documentUrl + "/sheets/sheet1"));
        assertEquals(HttpStatus.CONFLICT, lastSheet.getStatusCode());
    }

    @Test
    void testInsertFunction() {
        put("/sheets/sheet1/cells/A1", "{\"value\": 4}");
        put("/sheets/sheet1/cells/A2", "{\"value\": 6}");

        ResponseEntity<Map> inserted = restTemplate.postForEntity(documentUrl + "/sheets/sheet1/cells/B1/function",
                json("{\"functionName\": \"AVERAGE\", \"parameters\": [\"A1:A2\", 2]}"), Map.class);
        assertEquals(HttpStatus.OK, inserted.getStatusCode());
        assertEquals("=AVERAGE(A1:A2,2)", inserted.getBody().get("formula"));
        assertEquals(4, inserted.getBody().get("value"));

        HttpClientErrorException unknown = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.postForEntity(documentUrl + "/sheets/sheet1/cells/B2/function",
                        json("{\"functionName\": \"NOPE\", \"parameters\": []}"), Map.class));
        assertEquals(HttpStatus.BAD_REQUEST, unknown.getStatusCode());
        assertTrue(unknown.getResponseBodyAsString().contains("\"code\":\"VALIDATION_FAILED\""));
        assertTrue(unknown.getResponseBodyAsString().contains("\"message\":\"Unknown function: NOPE\""));
    }

    @Test
    void testExportedContentUsesDocumentFormat() {
        put("/sheets/sheet1/cells/B2", "{\"value\": \"hello\"}");

        Map content = restTemplate.getForObject(documentUrl + "/content", Map.class);
        assertEquals("Quarterly", content.get("title"));
        Map settings = (Map) content.get("settings");
        assertEquals("auto", settings.get("calculation"));
        List sheets = (List) content.get("sheets");
        Map sheet = (Map) sheets.get(0);
        assertEquals(100, sheet.get("rows"));
        assertEquals("hello", ((Map) ((Map) sheet.get("cells")).get("B2")).get("value"));
    }
}
