package scribe.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import scribe.core.model.post.Category;
import scribe.core.model.post.CategoryData;

/**
 * Port for managing post categories.
 */
public interface CategoryManagement {

    /**
     * Create a category with a generated id. A missing slug is derived from the name.
     */
    Uni<Category> createCategory(CategoryData data);

    /**
     * Replace the editable fields of a category.
     *
     * @return Uni with the updated category, failing with EntityNotFoundException if absent
     */
    Uni<Category> updateCategory(String categoryId, CategoryData data);

    /**
     * Store a captured category under its original id.
     */
    Uni<Category> restoreCategory(Category snapshot);

    /**
     * @return Uni with the category, failing with EntityNotFoundException if absent
     */
    Uni<Category> getCategory(String categoryId);

    /**
     * @return Uni with the deleted category, failing with EntityNotFoundException if absent
     */
    Uni<Category> deleteCategory(String categoryId);

    Uni<List<Category>> listCategories();
}
