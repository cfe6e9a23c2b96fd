package scribe.core.command.taxonomy;

import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.model.post.Category;
import scribe.core.model.post.CategoryData;
import scribe.core.port.in.CategoryManagement;

/**
 * Update a category; undo restores the captured version.
 */
public class UpdateCategoryCommand extends AbstractCommand<Category> {

    private final CategoryManagement categories;
    private final String categoryId;
    private final CategoryData data;

    private Category previous;

    public UpdateCategoryCommand(CategoryManagement categories, String categoryId, CategoryData data) {
        super("Update category");
        this.categories = categories;
        this.categoryId = categoryId;
        this.data = data;
    }

    @Override
    protected Uni<Category> apply() {
        return categories.getCategory(categoryId)
                .invoke(category -> previous = category)
                .flatMap(category -> categories.updateCategory(categoryId, data));
    }

    @Override
    protected Uni<Category> revert() {
        return categories.restoreCategory(previous);
    }
}
