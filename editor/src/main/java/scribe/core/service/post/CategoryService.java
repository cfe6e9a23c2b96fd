package scribe.core.service.post;

import java.util.List;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import scribe.core.model.editor.EntityNotFoundException;
import scribe.core.model.post.Category;
import scribe.core.model.post.CategoryData;
import scribe.core.port.in.CategoryManagement;
import scribe.core.port.out.CategoryRepository;

/**
 * Service for managing post categories.
 */
@ApplicationScoped
public class CategoryService implements CategoryManagement {

    private static final Logger LOG = Logger.getLogger(CategoryService.class);

    private final CategoryRepository repository;

    @Inject
    public CategoryService(CategoryRepository repository) {
        this.repository = repository;
    }

    @Override
    public Uni<Category> createCategory(CategoryData data) {
        return Uni.createFrom()
                .item(() -> Category.create(UUID.randomUUID().toString(), withSlug(data)))
                .call(repository::save)
                .invoke(category -> LOG.debugf("Created category %s (%s)", category.id(), category.name()));
    }

    @Override
    public Uni<Category> updateCategory(String categoryId, CategoryData data) {
        return find(categoryId).map(existing -> existing.withData(withSlug(data))).call(repository::save);
    }

    @Override
    public Uni<Category> restoreCategory(Category snapshot) {
        return repository.save(snapshot).replaceWith(snapshot);
    }

    @Override
    public Uni<Category> getCategory(String categoryId) {
        return find(categoryId);
    }

    @Override
    public Uni<Category> deleteCategory(String categoryId) {
        return find(categoryId)
                .call(category -> repository.delete(categoryId))
                .invoke(category -> LOG.debugf("Deleted category %s", categoryId));
    }

    @Override
    public Uni<List<Category>> listCategories() {
        return repository.findAll();
    }

    private Uni<Category> find(String categoryId) {
        return repository.findById(categoryId)
                .map(existing -> existing.orElseThrow(() -> new EntityNotFoundException("Category", categoryId)));
    }

    private static CategoryData withSlug(CategoryData data) {
        if (data.slug() != null && !data.slug().isBlank()) {
            return data;
        }
        return new CategoryData(
                data.name(), Slugs.slugify(data.name()), data.description(), data.color(), data.parentId());
    }
}
