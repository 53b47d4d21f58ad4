package com.starscape.notionsync.common.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NotionPropertiesTest {
    
    private static ValidatorFactory validatorFactory;
    private static Validator validator;
    
    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }
    
    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }
    
    @Test
    void shouldAcceptDefaults() {
        NotionProperties properties = new NotionProperties();
        properties.setApiKey("secret_abc");
        
        assertTrue(validator.validate(properties).isEmpty());
    }
    
    @Test
    void shouldRejectThresholdLargerThanOneArray() {
        NotionProperties properties = new NotionProperties();
        properties.setApiKey("secret_abc");
        properties.getUpload().setThresholdBytes(3L * 1024 * 1024 * 1024);
        
        Set<ConstraintViolation<NotionProperties>> violations = validator.validate(properties);
        
        assertEquals(1, violations.size());
        assertEquals("upload.thresholdBytes", violations.iterator().next().getPropertyPath().toString());
    }
    
    @Test
    void shouldRequireApiKey() {
        assertFalse(validator.validate(new NotionProperties()).isEmpty());
    }
    
    @Test
    void shouldSendBearerTokenAndVersion() {
        NotionProperties properties = new NotionProperties();
        properties.setApiKey("secret_abc");
        
        assertEquals("Bearer secret_abc", properties.defaultHeaders().get("Authorization"));
        assertEquals("2022-06-28", properties.defaultHeaders().get("Notion-Version"));
    }
}
