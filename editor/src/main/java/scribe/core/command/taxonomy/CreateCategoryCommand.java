package scribe.core.command.taxonomy;

import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.model.post.Category;
import scribe.core.model.post.CategoryData;
import scribe.core.port.in.CategoryManagement;

/**
 * Create a category; undo deletes it and redo brings it back under the same id.
 */
public class CreateCategoryCommand extends AbstractCommand<Category> {

    private final CategoryManagement categories;
    private final CategoryData data;

    private Category created;

    public CreateCategoryCommand(CategoryManagement categories, CategoryData data) {
        super("Create category");
        this.categories = categories;
        this.data = data;
    }

    @Override
    protected Uni<Category> apply() {
        return categories.createCategory(data).invoke(category -> created = category);
    }

    @Override
    protected Uni<Category> revert() {
        return categories.deleteCategory(created.id());
    }

    @Override
    protected Uni<Category> reapply() {
        return created != null ? categories.restoreCategory(created) : apply();
    }
}
