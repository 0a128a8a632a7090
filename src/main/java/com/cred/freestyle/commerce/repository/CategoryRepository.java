package com.cred.freestyle.commerce.repository;

import com.cred.freestyle.commerce.domain.model.Category;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CategoryRepository extends JpaRepository<Category, String> {

    boolean existsByCategoryName(String categoryName);

    List<Category> findAllByOrderByCategoryNameAsc();
}
