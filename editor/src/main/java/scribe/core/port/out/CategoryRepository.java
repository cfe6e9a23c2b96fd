package scribe.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import scribe.core.model.post.Category;

/**
 * Port interface for persistent storage of categories.
 */
public interface CategoryRepository {

    Uni<Void> save(Category category);

    Uni<Optional<Category>> findById(String categoryId);

    /**
     * Delete a category.
     *
     * @param categoryId the category identifier
     * @return Uni with true if deleted, false if not found
     */
    Uni<Boolean> delete(String categoryId);

    Uni<List<Category>> findAll();
}
