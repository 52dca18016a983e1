package org.example.evaluappclient.service;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.MappingBuilder;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import common.enums.QuestionType;
import common.model.exam.Exam;
import common.model.exam.Question;
import org.example.evaluappclient.api.ApiClient;
import org.example.evaluappclient.api.ApiResult;
import org.example.evaluappclient.api.ErrorKind;
import org.example.evaluappclient.config.ClientConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.anyRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.anyUrl;
import static com.github.tomakehurst.wiremock.client.WireMock.delete;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.put;
import static com.github.tomakehurst.wiremock.client.WireMock.putRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExamService")
class ExamServiceTest {

    private static final LocalDate START = LocalDate.of(2025, 3, 1);
    private static final LocalDate END = LocalDate.of(2025, 3, 8);

    private WireMockServer wireMockServer;
    private ExamService examService;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        ClientConfig config = ClientConfig.builder()
                .baseUrl(wireMockServer.baseUrl())
                .token("t0k3n")
                .build();
        examService = new ExamService(new ApiClient(config));
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
    }

    private void stubJson(MappingBuilder request, int status, String body) {
        wireMockServer.stubFor(request.willReturn(aResponse()
                .withStatus(status)
                .withHeader("Content-Type", "application/json")
                .withBody(body)));
    }

    @Nested
    @DisplayName("createExam")
    class CreateExam {

        @Test
        @DisplayName("valid exam issues exactly one POST and returns the decoded record")
        void validExam_singlePost() {
            stubJson(post(urlEqualTo("/examenes")), 201, """
                    {"id": 12, "titulo": "Algebra", "descripcion": "Tema 1",
                     "fechaInicio": "2025-03-01", "fechaFin": "2025-03-08",
                     "creadorId": 1, "creadorNombre": "Ana", "preguntasIds": []}
                    """);

            ApiResult<Exam> result = examService.createExam("Algebra", "Tema 1", START, END, 1L);

            assertThat(result.isSuccess()).isTrue();
            Exam exam = result.getValue();
            assertThat(exam.getId()).isEqualTo(12L);
            assertThat(exam.getCreatorName()).isEqualTo("Ana");
            assertThat(exam.getStartDate()).isEqualTo(START);
            assertThat(exam.getQuestionIds()).isEmpty();

            wireMockServer.verify(1, anyRequestedFor(anyUrl()));
            wireMockServer.verify(1, postRequestedFor(urlEqualTo("/examenes"))
                    .withHeader("Authorization", equalTo("Bearer t0k3n"))
                    .withRequestBody(equalToJson("""
                            {"titulo": "Algebra", "descripcion": "Tema 1",
                             "fechaInicio": "2025-03-01", "fechaFin": "2025-03-08",
                             "creadorId": 1, "preguntasIds": []}
                            """)));
        }

        @ParameterizedTest(name = "start={0}, end={1}")
        @CsvSource({"2025-03-08,2025-03-01", "2025-03-01,2025-03-01"})
        @DisplayName("start not before end is a validation error with no network call")
        void invertedRange_noNetwork(LocalDate start, LocalDate end) {
            ApiResult<Exam> result = examService.createExam("Algebra", "", start, end, 1L);

            assertThat(result.getError().getKind()).isEqualTo(ErrorKind.VALIDATION);
            wireMockServer.verify(0, anyRequestedFor(anyUrl()));
        }

        @Test
        @DisplayName("blank title is a validation error with no network call")
        void blankTitle_noNetwork() {
            ApiResult<Exam> result = examService.createExam("   ", "", START, END, 1L);

            assertThat(result.getError().getKind()).isEqualTo(ErrorKind.VALIDATION);
            assertThat(examService.createExam(null, "", START, END, 1L).isFailure()).isTrue();
            assertThat(examService.createExam("A", "", null, END, 1L).isFailure()).isTrue();
            wireMockServer.verify(0, anyRequestedFor(anyUrl()));
        }

        @Test
        @DisplayName("backend rejection is surfaced verbatim")
        void backendRejects() {
            stubJson(post(urlEqualTo("/examenes")), 400, "{\"message\":\"titulo duplicado\"}");

            ApiResult<Exam> result = examService.createExam("Algebra", "", START, END, 1L);

            assertThat(result.getError().getKind()).isEqualTo(ErrorKind.HTTP);
            assertThat(result.getError().getStatusCode()).isEqualTo(400);
            assertThat(result.getError().getBodySnippet()).contains("titulo duplicado");
        }

        @Test
        @DisplayName("a bare 201 to the create gives no id and is a decode error")
        void bodylessCreate() {
            wireMockServer.stubFor(post(urlEqualTo("/examenes")).willReturn(aResponse().withStatus(201)));

            ApiResult<Exam> result = examService.createExam("Algebra", "", START, END, 1L);

            assertThat(result.getError().getKind()).isEqualTo(ErrorKind.DECODE);
        }

        @Test
        @DisplayName("created record without an id is a decode error")
        void missingId() {
            stubJson(post(urlEqualTo("/examenes")), 201, "{\"titulo\": \"Algebra\"}");

            ApiResult<Exam> result = examService.createExam("Algebra", "", START, END, 1L);

            assertThat(result.getError().getKind()).isEqualTo(ErrorKind.DECODE);
        }
    }

    @Nested
    @DisplayName("listing")
    class Listing {

        @Test
        @DisplayName("lists typed exams")
        void listExams() {
            stubJson(get(urlEqualTo("/examenes")), 200, """
                    [{"id": 1, "titulo": "A", "fechaInicio": "2025-03-01", "fechaFin": "2025-03-08", "preguntasIds": [4, 5]},
                     {"id": "2", "titulo": "B", "fechaInicio": "2025-04-01T00:00:00", "fechaFin": "2025-04-08"}]
                    """);

            List<Exam> exams = examService.listExams().getValue();

            assertThat(exams).extracting(Exam::getId).containsExactly(1L, 2L);
            assertThat(exams.get(0).getQuestionIds()).containsExactly(4L, 5L);
            assertThat(exams.get(1).getStartDate()).isEqualTo(LocalDate.of(2025, 4, 1));
        }

        @Test
        @DisplayName("empty body lists zero exams")
        void emptyBody() {
            stubJson(get(urlEqualTo("/examenes")), 200, "");

            assertThat(examService.listExams().getValue()).isEmpty();
        }

        @Test
        @DisplayName("active exams are those open today with questions")
        void listActive() {
            stubJson(get(urlEqualTo("/examenes")), 200, """
                    [{"id": 1, "titulo": "open", "fechaInicio": "2025-03-01", "fechaFin": "2025-03-08", "preguntasIds": [4]},
                     {"id": 2, "titulo": "no questions", "fechaInicio": "2025-03-01", "fechaFin": "2025-03-08", "preguntasIds": []},
                     {"id": 3, "titulo": "future", "fechaInicio": "2025-04-01", "fechaFin": "2025-04-08", "preguntasIds": [7]},
                     {"id": 4, "titulo": "no dates", "preguntasIds": [8]}]
                    """);

            List<Exam> active = examService.listActiveExams(LocalDate.of(2025, 3, 5)).getValue();

            assertThat(active).extracting(Exam::getTitle).containsExactly("open");
        }

        @Test
        @DisplayName("questions of an exam accept either field spelling")
        void getQuestions() {
            stubJson(get(urlEqualTo("/examenes/12/preguntas")), 200, """
                    [{"id": 1, "textoPregunta": "2+2?", "tipo": "SELECCION_UNICA", "puntos": 2,
                      "opciones": [{"id": 10, "texto": "3", "esCorrecta": false},
                                   {"id": 11, "textoPregunta": "4", "esCorrecta": true}]},
                     {"id": 2, "textoPregunta": "Explica", "tipoPregunta": "TEXTO_ABIERTO"}]
                    """);

            List<Question> questions = examService.getQuestions(12L).getValue();

            assertThat(questions).hasSize(2);
            assertThat(questions.get(0).getType()).isEqualTo(QuestionType.SELECCION_UNICA);
            assertThat(questions.get(0).getOptions()).extracting("text").containsExactly("3", "4");
            assertThat(questions.get(0).getOptions().get(1).isCorrect()).isTrue();
            assertThat(questions.get(1).getType()).isEqualTo(QuestionType.TEXTO_ABIERTO);
        }

        @Test
        @DisplayName("student view never shows which option is correct")
        void getQuestionsForStudent() {
            stubJson(get(urlEqualTo("/examenes/12/preguntas")), 200, """
                    [{"id": 1, "textoPregunta": "2+2?", "tipoPregunta": "SELECCION_UNICA",
                      "opciones": [{"id": 10, "texto": "3"}, {"id": 11, "texto": "4", "esCorrecta": true}]}]
                    """);

            List<Question> questions = examService.getQuestionsForStudent(12L).getValue();

            assertThat(questions.get(0).getOptions()).noneMatch(option -> option.isCorrect());
            assertThat(questions.get(0).getOptions()).extracting("id").containsExactly(10L, 11L);
        }

        @Test
        @DisplayName("a single object where a list is expected is a decode error")
        void questionsWrongShape() {
            stubJson(get(urlEqualTo("/examenes/12/preguntas")), 200, "{\"id\": 1}");

            assertThat(examService.getQuestions(12L).getError().getKind()).isEqualTo(ErrorKind.DECODE);
        }
    }

    @Nested
    @DisplayName("update and delete")
    class UpdateAndDelete {

        @Test
        @DisplayName("update resends every field, question ids included")
        void updateResendsAllFields() {
            stubJson(put(urlEqualTo("/examenes/12")), 200, "{\"id\": 12}");

            ApiResult<Void> result = examService.updateExam(12L, "Algebra II", "nuevo", START, END, 1L, List.of(4L, 5L));

            assertThat(result.isSuccess()).isTrue();
            wireMockServer.verify(putRequestedFor(urlEqualTo("/examenes/12"))
                    .withRequestBody(equalToJson("""
                            {"titulo": "Algebra II", "descripcion": "nuevo",
                             "fechaInicio": "2025-03-01", "fechaFin": "2025-03-08",
                             "creadorId": 1, "preguntasIds": [4, 5]}
                            """)));
        }

        @Test
        @DisplayName("a bare 200 to the update is a success")
        void bodylessUpdate() {
            wireMockServer.stubFor(put(urlEqualTo("/examenes/7")).willReturn(aResponse().withStatus(200)));

            ApiResult<Void> result = examService.updateExam(7L, "Algebra", "", START, END, 1L, List.of(4L));

            assertThat(result.isSuccess()).isTrue();
        }

        @Test
        @DisplayName("attachQuestion appends the id to the existing ones")
        void attachQuestion() {
            stubJson(put(urlEqualTo("/examenes/12")), 200, "{\"id\": 12}");
            Exam exam = Exam.builder().id(12L).title("A").startDate(START).endDate(END)
                    .creatorId(1L).questionIds(List.of(4L)).build();

            Exam updated = examService.attachQuestion(exam, 9L).getValue();

            assertThat(updated.getQuestionIds()).containsExactly(4L, 9L);
            assertThat(exam.getQuestionIds()).containsExactly(4L);
            wireMockServer.verify(putRequestedFor(urlEqualTo("/examenes/12"))
                    .withRequestBody(equalToJson("{\"preguntasIds\": [4, 9]}", false, true)));
        }

        @Test
        @DisplayName("update with an inverted range never reaches the backend")
        void updateValidation() {
            ApiResult<Void> result = examService.updateExam(12L, "A", "", END, START, 1L, List.of());

            assertThat(result.getError().getKind()).isEqualTo(ErrorKind.VALIDATION);
            wireMockServer.verify(0, anyRequestedFor(anyUrl()));
        }

        @Test
        @DisplayName("delete succeeds on 204")
        void delete204() {
            wireMockServer.stubFor(delete(urlEqualTo("/examenes/12")).willReturn(aResponse().withStatus(204)));

            assertThat(examService.deleteExam(12L).isSuccess()).isTrue();
        }

        @Test
        @DisplayName("delete answered with 200 is an error")
        void delete200() {
            stubJson(delete(urlEqualTo("/examenes/12")), 200, "{}");

            ApiResult<Void> result = examService.deleteExam(12L);

            assertThat(result.getError().getKind()).isEqualTo(ErrorKind.HTTP);
            assertThat(result.getError().getStatusCode()).isEqualTo(200);
        }

        @Test
        @DisplayName("delete of a missing exam reports 404")
        void delete404() {
            stubJson(delete(urlEqualTo("/examenes/99")), 404, "{\"message\":\"not found\"}");

            assertThat(examService.deleteExam(99L).getError().getStatusCode()).isEqualTo(404);
        }
    }

    @Nested
    @DisplayName("isActive")
    class IsActive {

        private final Exam exam = Exam.builder()
                .id(1L).title("A").startDate(START).endDate(END).questionIds(List.of(4L)).build();

        @Test
        @DisplayName("window bounds are inclusive")
        void inclusiveBounds() {
            assertThat(ExamService.isActive(exam, START)).isTrue();
            assertThat(ExamService.isActive(exam, END)).isTrue();
            assertThat(ExamService.isActive(exam, START.plusDays(3))).isTrue();
        }

        @Test
        @DisplayName("outside the window is inactive")
        void outside() {
            assertThat(ExamService.isActive(exam, START.minusDays(1))).isFalse();
            assertThat(ExamService.isActive(exam, END.plusDays(1))).isFalse();
        }

        @Test
        @DisplayName("no questions means inactive")
        void noQuestions() {
            Exam empty = exam.toBuilder().questionIds(List.of()).build();
            Exam nullIds = exam.toBuilder().questionIds(null).build();

            assertThat(ExamService.isActive(empty, START)).isFalse();
            assertThat(ExamService.isActive(nullIds, START)).isFalse();
        }

        @Test
        @DisplayName("missing dates mean inactive")
        void missingDates() {
            assertThat(ExamService.isActive(exam.toBuilder().startDate(null).build(), START)).isFalse();
            assertThat(ExamService.isActive(exam.toBuilder().endDate(null).build(), START)).isFalse();
            assertThat(ExamService.isActive(null, START)).isFalse();
        }
    }
}
