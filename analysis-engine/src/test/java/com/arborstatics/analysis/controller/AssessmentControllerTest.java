package com.arborstatics.analysis.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = "logging.level.com.arborstatics.analysis.config=DEBUG")
@AutoConfigureWebTestClient
@ExtendWith(OutputCaptureExtension.class)
class AssessmentControllerTest {

    private static final String BASE = "/api/v1/assessment";

    private static final String REFERENCE_TREE = """
        {
          "speciesId": "euc_typical",
          "dbh": 50.0,
          "height": 18.0,
          "crownDiameter": 10.0,
          "designWindSpeed": 40.0
        }
        """;

    @Autowired
    private WebTestClient webTestClient;

    private WebTestClient.ResponseSpec post(String path, String body) {
        return webTestClient.post().uri(BASE + path)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .exchange();
    }

    @Nested
    @DisplayName("catalogues")
    class CatalogueEndpointTests {

        @Test
        @DisplayName("GET /species lists all 60 presets")
        void species() {
            webTestClient.get().uri(BASE + "/species").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(60)
                .jsonPath("$[?(@.id == 'euc_typical')].greenBendingStrength").isEqualTo(35.0);
        }

        @Test
        @DisplayName("GET /wind-profiles lists the eight regions in order")
        void windProfiles() {
            webTestClient.get().uri(BASE + "/wind-profiles").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(8)
                .jsonPath("$[0].id").isEqualTo("A_urban")
                .jsonPath("$[7].designWindSpeed").isEqualTo(60.0);
        }

        @Test
        @DisplayName("GET /health")
        void health() {
            webTestClient.get().uri(BASE + "/health").exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("OK");
        }
    }

    @Nested
    @DisplayName("POST /evaluate")
    class EvaluateTests {

        @Test
        @DisplayName("reference tree → 200 with SF, rating and sweeps")
        void reference() {
            post("/evaluate", REFERENCE_TREE)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.result.safetyFactor").value(closeTo(3.0445, 1e-4))
                .jsonPath("$.rating").isEqualTo("ADEQUATE")
                .jsonPath("$.windToFailure").value(closeTo(69.79, 0.01))
                .jsonPath("$.safetyFactorVsWind.points.length()").isEqualTo(12)
                .jsonPath("$.windScenarios.D_open").exists()
                .jsonPath("$.rootPlate").isEmpty();
        }

        @Test
        @DisplayName("invalid geometry → 400 with the issue list")
        void invalid() {
            post("/evaluate", """
                {"speciesId": "euc_typical", "dbh": 0, "height": 18, "crownDiameter": 10, "designWindSpeed": 40}
                """)
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_INPUT")
                .jsonPath("$.issues[0].message").isEqualTo("DBH must be greater than zero.")
                .jsonPath("$.issues[0].isError").isEqualTo(true);
        }

        @Test
        @DisplayName("unknown species → 404")
        void unknownSpecies() {
            post("/evaluate", """
                {"speciesId": "baobab", "dbh": 50, "height": 18, "crownDiameter": 10, "designWindSpeed": 40}
                """)
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("UNKNOWN_PROFILE");
        }

        @Test
        @DisplayName("rejections are logged with the handler's component prefix")
        void rejectionLogged(CapturedOutput output) {
            post("/evaluate", """
                {"speciesId": "kauri", "dbh": 50, "height": 18, "crownDiameter": 10, "designWindSpeed": 40}
                """)
                .expectStatus().isNotFound();

            assertTrue(output.getOut().contains("[AssessmentExceptionHandler] Unknown profile requested: kauri"));
        }

        @Test
        @DisplayName("defects and root plate accepted as nested objects")
        void nestedObservations() {
            post("/evaluate", """
                {
                  "speciesId": "euc_typical", "dbh": 50, "height": 18, "crownDiameter": 10,
                  "windProfileId": "B_urban",
                  "defects": {"cracks": true, "decayType": "BROWN_ROT"},
                  "rootPlate": {"soilType": "ROCKY", "soilMoisture": "DRY", "restriction": "NONE"}
                }
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.designWindSpeed").isEqualTo(40.0)
                .jsonPath("$.defectStrengthFactor").value(closeTo(0.85, 1e-12))
                .jsonPath("$.rootPlate.risk").isEqualTo("LOW");
        }
    }

    @Nested
    @DisplayName("POST /validate and /pruning")
    class OtherEndpointTests {

        @Test
        @DisplayName("/validate returns warnings with 200")
        void validate() {
            post("/validate", """
                {"speciesId": "euc_typical", "dbh": 50, "height": 18, "crownDiameter": 10, "designWindSpeed": 90}
                """)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].isError").isEqualTo(false);
        }

        @Test
        @DisplayName("/pruning without an assessment → 400")
        void pruningMissingAssessment() {
            post("/pruning", "{\"crownReductionPercent\": 30, \"fullnessReductionPercent\": 20}")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_INPUT")
                .jsonPath("$.issues[0].isError").isEqualTo(true);
        }

        @Test
        @DisplayName("/pruning returns before/after and the reduction curve")
        void pruning() {
            post("/pruning", "{\"assessment\": " + REFERENCE_TREE
                + ", \"crownReductionPercent\": 30, \"fullnessReductionPercent\": 20}")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.scenario.crownDiameterAfter").value(closeTo(7.0, 1e-9))
                .jsonPath("$.scenario.fullnessAfter").value(closeTo(0.72, 1e-9))
                .jsonPath("$.reductionCurve.points.length()").isEqualTo(9);
        }
    }
}
