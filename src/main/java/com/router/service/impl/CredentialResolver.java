package com.router.service.impl;

import com.router.config.LlmProperties;
import com.router.exception.MissingCredentialException;
import com.router.model.ModelConfig;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Looks up the API key of a model: by full model id, then by provider prefix, then by bare
 * model name.
 */
@Component
public class CredentialResolver {

    private final LlmProperties properties;

    public CredentialResolver(LlmProperties properties) {
        this.properties = properties;
    }

    /**
     * @throws MissingCredentialException if no non-blank key is configured
     */
    public String resolve(ModelConfig model) {
        if (model == null || model.llm() == null || model.llm().isBlank()) {
            throw new MissingCredentialException(String.valueOf(model == null ? null : model.llm()));
        }
        Map<String, String> keys = properties.getApiKeys();
        String llm = model.llm();
        String key = keys.get(llm);
        int slash = llm.indexOf('/');
        if (isBlank(key) && slash > 0) {
            key = keys.get(llm.substring(0, slash));
        }
        if (isBlank(key)) {
            key = keys.get(model.modelName());
        }
        if (isBlank(key)) {
            throw new MissingCredentialException(llm);
        }
        return key;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
