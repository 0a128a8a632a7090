package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.Category;
import com.cred.freestyle.commerce.exception.DuplicateResourceException;
import com.cred.freestyle.commerce.exception.ResourceNotFoundException;
import com.cred.freestyle.commerce.repository.CategoryRepository;
import com.cred.freestyle.commerce.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class CategoryService {

    private static final Logger logger = LoggerFactory.getLogger(CategoryService.class);

    private final CategoryRepository categoryRepository;
    private final AuditService auditService;

    public CategoryService(CategoryRepository categoryRepository, AuditService auditService) {
        this.categoryRepository = categoryRepository;
        this.auditService = auditService;
    }

    @Transactional
    public Category createCategory(String categoryName, String description) {
        String name = categoryName.trim();
        if (categoryRepository.existsByCategoryName(name)) {
            throw new DuplicateResourceException("Category", "categoryName", name);
        }

        Category category = categoryRepository.save(Category.builder()
                .categoryName(name)
                .description(description)
                .build());

        auditService.record(SecurityUtils.getCurrentUserId(), AuditAction.CREATE, "categories",
                category.getCategoryId(), null, category);
        logger.info("Created category {} ({})", category.getCategoryId(), name);
        return category;
    }

    @Transactional(readOnly = true)
    public List<Category> listCategories() {
        return categoryRepository.findAllByOrderByCategoryNameAsc();
    }

    @Transactional(readOnly = true)
    public Category getCategory(String categoryId) {
        return categoryRepository.findById(categoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Category", categoryId));
    }

    @Transactional(readOnly = true)
    public boolean exists(String categoryId) {
        return categoryRepository.existsById(categoryId);
    }
}
