package com.router.dto.request;

import java.util.Map;

/**
 * One entry of a catalog upload file: the text that is embedded and the operation metadata
 * stored with it ({@code url}, {@code method}, {@code description}, {@code parameters},
 * {@code body}, {@code response}).
 */
public record DocumentUpload(String text, Map<String, Object> metadata) {
}
