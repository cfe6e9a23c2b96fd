package scribe.core.command.taxonomy;

import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.model.post.Category;
import scribe.core.port.in.CategoryManagement;

/**
 * Delete a category; undo re-creates it under the same id.
 */
public class DeleteCategoryCommand extends AbstractCommand<Category> {

    private final CategoryManagement categories;
    private final String categoryId;

    private Category deleted;

    public DeleteCategoryCommand(CategoryManagement categories, String categoryId) {
        super("Delete category");
        this.categories = categories;
        this.categoryId = categoryId;
    }

    @Override
    protected Uni<Category> apply() {
        return categories.deleteCategory(categoryId).invoke(category -> deleted = category);
    }

    @Override
    protected Uni<Category> revert() {
        return categories.restoreCategory(deleted);
    }
}
