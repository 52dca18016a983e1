package org.example.evaluappclient.service;

import common.constant.ApiRoutes;
import common.model.User;
import lombok.extern.slf4j.Slf4j;
import org.example.evaluappclient.api.ApiClient;
import org.example.evaluappclient.api.ApiResult;

import java.util.List;

@Slf4j
public class UserService {
    private final ApiClient apiClient;

    public UserService(ApiClient apiClient) {
        this.apiClient = apiClient;
    }

    /**
     * Lấy danh sách users (admin)
     */
    public ApiResult<List<User>> listUsers() {
        ApiResult<List<User>> result = apiClient.getList(ApiRoutes.USERS, null, User.class);
        if (result.isFailure()) {
            log.error("❌ List users failed: {}", result.getError().toDisplayMessage());
        }
        return result;
    }
}
