package dev.newsroom.service;

import dev.newsroom.entity.Article;
import dev.newsroom.entity.UserRole;
import dev.newsroom.exception.ArticleWorkflowException;
import dev.newsroom.security.AuthenticatedUser;
import dev.newsroom.service.persistence.ArticleFilters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Role and ownership rules. AUTHOR works on own articles only; EDITOR and ADMIN on every article.
 */
@Component
@Slf4j
public class ArticleAccessPolicy {

    public void requireRole(AuthenticatedUser user, UserRole... allowed) {
        if (user == null) {
            throw ArticleWorkflowException.unauthorized("Authentication required");
        }
        if (!user.hasAnyRole(allowed)) {
            log.warn("Access denied: user={} role={}", user.id(), user.role());
            throw ArticleWorkflowException.forbidden("You are not authorized to perform this action.");
        }
    }

    public void requireAnyRole(AuthenticatedUser user) {
        requireRole(user, UserRole.AUTHOR, UserRole.EDITOR, UserRole.ADMIN);
    }

    public void requireEditor(AuthenticatedUser user) {
        requireRole(user, UserRole.EDITOR, UserRole.ADMIN);
    }

    public void requireCanAccess(AuthenticatedUser user, Article article) {
        if (user.isAuthor() && !article.isOwnedBy(user.id())) {
            log.warn("Access denied: author {} attempted to access article {}", user.id(), article.getId());
            throw ArticleWorkflowException.forbidden("You can only access your own articles");
        }
    }

    /**
     * Forces an AUTHOR's listing onto their own articles.
     */
    public ArticleFilters scope(AuthenticatedUser user, ArticleFilters filters) {
        if (!user.isAuthor()) {
            return filters;
        }
        if (filters.getAuthorId() != null && !filters.getAuthorId().equals(user.id())) {
            log.warn("Access denied: author {} attempted to list articles of {}", user.id(), filters.getAuthorId());
            throw ArticleWorkflowException.forbidden("You can only view your own articles");
        }
        return filters.withAuthorId(user.id());
    }
}
