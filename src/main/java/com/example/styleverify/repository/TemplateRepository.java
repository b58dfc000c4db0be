package com.example.styleverify.repository;

import com.example.styleverify.model.Template;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Template versions (collection templates).
 */
public interface TemplateRepository extends MongoRepository<Template, String> {

    List<Template> findByNameOrderByVersionDesc(String name);
}
