package org.example.evaluappclient.service;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import common.enums.UserRole;
import common.model.User;
import org.example.evaluappclient.api.ApiClient;
import org.example.evaluappclient.api.ErrorKind;
import org.example.evaluappclient.config.ClientConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;

class UserServiceTest {

    private WireMockServer wireMockServer;
    private UserService userService;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        userService = new UserService(new ApiClient(ClientConfig.builder()
                .baseUrl(wireMockServer.baseUrl())
                .token("admin")
                .build()));
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
    }

    @Test
    void listsUsersWithEitherFieldSpelling() {
        wireMockServer.stubFor(get(urlEqualTo("/admin/users")).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "application/json")
                .withBody("""
                        [{"id": 1, "nombre": "Ana", "email": "ana@uni.edu", "rol": "admin"},
                         {"id": 2, "name": "Luis", "role": "STUDENT"},
                         {"id": 3, "nombre": "Eva", "rol": "AUDITOR"}]
                        """)));

        List<User> users = userService.listUsers().getValue();

        assertThat(users).extracting(User::getFullName).containsExactly("Ana", "Luis", "Eva");
        assertThat(users).extracting(User::getUserRole)
                .containsExactly(UserRole.ADMIN, UserRole.STUDENT, null);
    }

    @Test
    void forbiddenIsAnHttpError() {
        wireMockServer.stubFor(get(urlEqualTo("/admin/users")).willReturn(aResponse()
                .withStatus(403)
                .withBody("forbidden")));

        assertThat(userService.listUsers().getError().getKind()).isEqualTo(ErrorKind.HTTP);
        assertThat(userService.listUsers().getError().getStatusCode()).isEqualTo(403);
    }
}
