package com.pressroom.api.relation;

import com.pressroom.core.domain.Account;
import com.pressroom.core.domain.Content;
import com.pressroom.core.domain.ContentTag;
import com.pressroom.core.domain.Profile;
import com.pressroom.core.domain.Tag;
import com.pressroom.core.relation.Relation;
import com.pressroom.core.repository.AccountRepository;
import com.pressroom.core.repository.ContentRepository;
import com.pressroom.core.repository.ContentTagRepository;
import com.pressroom.core.repository.ProfileRepository;
import com.pressroom.core.repository.TagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves and maintains the declared {@link Relation}s using bare foreign keys.
 * 
 * Every lookup is an explicit query keyed on ids; entities carry no mapped
 * associations, so nothing is loaded behind the caller's back. The lookup path is
 * read from the relation itself: a joined relation goes through its join entity, a
 * source-owned key loads the owners by id, and a target-owned key queries the
 * target rows by that key. Batch resolution issues one query per hop regardless of
 * how many roots are passed.
 */
@Component
public class RelationshipGraph {

    private static final Logger log = LoggerFactory.getLogger(RelationshipGraph.class);

    private static final Comparator<Content> NEWEST_FIRST = Comparator
            .comparing(Content::getCreatedAt).reversed()
            .thenComparing(Content::getId, Comparator.reverseOrder());

    private final ContentTagRepository contentTagRepository;
    private final Map<Class<?>, EntityAccess<?>> entities = new HashMap<>();

    public RelationshipGraph(
            AccountRepository accountRepository,
            ProfileRepository profileRepository,
            ContentRepository contentRepository,
            TagRepository tagRepository,
            ContentTagRepository contentTagRepository) {
        this.contentTagRepository = contentTagRepository;

        register(new EntityAccess<>(Account.class, Account::getId, accountRepository::findAllById,
                Comparator.comparing(Account::getId)));
        register(new EntityAccess<>(Profile.class, Profile::getId, profileRepository::findAllById,
                Comparator.comparing(Profile::getId))
                .withKey("accountId", Profile::getAccountId, profileRepository::findByAccountIdIn));
        register(new EntityAccess<>(Content.class, Content::getId, contentRepository::findAllById, NEWEST_FIRST)
                .withKey("accountId", Content::getAccountId, contentRepository::findByAccountIdIn));
        register(new EntityAccess<>(Tag.class, Tag::getId, tagRepository::findAllById,
                Comparator.comparing(Tag::getName)));
        register(new EntityAccess<>(ContentTag.class, ContentTag::getId, contentTagRepository::findAllById,
                Comparator.comparing(ContentTag::getId))
                .withKey("contentId", ContentTag::getContentId, contentTagRepository::findByContentIdIn)
                .withKey("tagId", ContentTag::getTagId, contentTagRepository::findByTagIdIn));

        for (Relation<?, ?> relation : Relation.all()) {
            checkDeclaration(relation);
        }
    }

    /**
     * Fetches the rows related to one loaded root entity.
     *
     * @return related rows, empty when nothing is related
     */
    @Transactional(readOnly = true)
    public <S, T> List<T> resolve(S root, Relation<S, T> relation) {
        Long rootId = access(relation.getSourceType()).id().apply(root);
        return resolveAll(List.of(root), relation).getOrDefault(rootId, List.of());
    }

    /**
     * Single-valued variant of {@link #resolve(Object, Relation)}.
     */
    @Transactional(readOnly = true)
    public <S, T> Optional<T> resolveOne(S root, Relation<S, T> relation) {
        return resolve(root, relation).stream().findFirst();
    }

    /**
     * Fetches related rows for many roots at once. Collection relations come back in
     * the target's natural order: content newest first, tags by name.
     *
     * @return related rows keyed by root id; roots with nothing related are absent
     */
    @Transactional(readOnly = true)
    public <S, T> Map<Long, List<T>> resolveAll(Collection<S> roots, Relation<S, T> relation) {
        if (roots.isEmpty()) {
            return Map.of();
        }
        EntityAccess<S> source = access(relation.getSourceType());
        EntityAccess<T> target = access(relation.getTargetType());

        Map<Long, List<T>> resolved;
        if (relation.isJoined()) {
            resolved = throughJoin(ids(roots, source), access(relation.getJoinType()),
                    relation.getJoinSourceKey(), relation.getJoinTargetKey(), target);
        } else if (relation.isOwnedBySource()) {
            resolved = owners(roots, source, source.key(relation.getForeignKey()), target);
        } else {
            resolved = groupBy(target.finder(relation.getForeignKey()).apply(ids(roots, source)),
                    target.key(relation.getForeignKey()));
        }
        if (relation.getCardinality().isCollection()) {
            resolved.values().forEach(list -> list.sort(target.order()));
        }
        return resolved;
    }

    /**
     * Records a content/tag pairing unless it already exists.
     *
     * @return true if a join row was inserted
     */
    @Transactional
    public boolean link(Long contentId, Long tagId) {
        if (contentTagRepository.existsByContentIdAndTagId(contentId, tagId)) {
            log.debug("Content {} already tagged with {}", contentId, tagId);
            return false;
        }
        contentTagRepository.save(new ContentTag(contentId, tagId));
        return true;
    }

    /**
     * Removes a content/tag pairing. Removing a pairing that does not exist is a no-op.
     *
     * @return number of join rows removed
     */
    public int unlink(Long contentId, Long tagId) {
        return contentTagRepository.deletePairing(contentId, tagId);
    }

    private <J, T> Map<Long, List<T>> throughJoin(
            Set<Long> rootIds, EntityAccess<J> join, String sourceKey, String targetKey, EntityAccess<T> target) {
        List<J> joins = join.finder(sourceKey).apply(rootIds);
        Function<J, Long> toSource = join.key(sourceKey);
        Function<J, Long> toTarget = join.key(targetKey);
        Map<Long, T> targets = byId(target.loader().apply(collect(joins, toTarget)), target.id());
        Map<Long, List<T>> result = new HashMap<>();
        for (J row : joins) {
            T related = targets.get(toTarget.apply(row));
            if (related == null) {
                continue;
            }
            List<T> list = result.computeIfAbsent(toSource.apply(row), id -> new ArrayList<>());
            if (!list.contains(related)) {
                list.add(related);
            }
        }
        return result;
    }

    private static <S, T> Map<Long, List<T>> owners(
            Collection<S> roots, EntityAccess<S> source, Function<S, Long> foreignKey, EntityAccess<T> target) {
        Map<Long, T> owners = byId(target.loader().apply(collect(roots, foreignKey)), target.id());
        Map<Long, List<T>> result = new HashMap<>();
        for (S root : roots) {
            T owner = owners.get(foreignKey.apply(root));
            if (owner != null) {
                result.put(source.id().apply(root), List.of(owner));
            }
        }
        return result;
    }

    private void register(EntityAccess<?> access) {
        entities.put(access.type(), access);
    }

    @SuppressWarnings("unchecked")
    private <E> EntityAccess<E> access(Class<E> type) {
        EntityAccess<?> access = entities.get(type);
        if (access == null) {
            throw new IllegalArgumentException("No relation access for " + type.getSimpleName());
        }
        return (EntityAccess<E>) access;
    }

    private void checkDeclaration(Relation<?, ?> relation) {
        access(relation.getSourceType());
        if (relation.isJoined()) {
            access(relation.getJoinType()).finder(relation.getJoinSourceKey());
            access(relation.getJoinType()).key(relation.getJoinTargetKey());
        } else if (relation.isOwnedBySource()) {
            access(relation.getSourceType()).key(relation.getForeignKey());
        } else {
            access(relation.getTargetType()).finder(relation.getForeignKey());
        }
    }

    private static <T> Map<Long, List<T>> groupBy(List<T> rows, Function<T, Long> key) {
        Map<Long, List<T>> grouped = new HashMap<>();
        for (T row : rows) {
            grouped.computeIfAbsent(key.apply(row), id -> new ArrayList<>()).add(row);
        }
        return grouped;
    }

    private static <T> Map<Long, T> byId(List<T> rows, Function<T, Long> id) {
        return rows.stream().collect(Collectors.toMap(id, Function.identity()));
    }

    private static <R> Set<Long> collect(Collection<R> rows, Function<R, Long> key) {
        return rows.stream().map(key).filter(Objects::nonNull).collect(Collectors.toSet());
    }

    private static <S> Set<Long> ids(Collection<S> roots, EntityAccess<S> source) {
        return roots.stream().map(source.id()).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * How the graph reads one entity type: its id, its foreign-key attributes by
     * name, and the repository queries that load rows by id or by a foreign key.
     */
    private record EntityAccess<E>(
            Class<E> type,
            Function<E, Long> id,
            Function<Collection<Long>, List<E>> loader,
            Comparator<E> order,
            Map<String, Function<E, Long>> keys,
            Map<String, Function<Collection<Long>, List<E>>> finders) {

        EntityAccess(Class<E> type, Function<E, Long> id,
                     Function<Collection<Long>, List<E>> loader, Comparator<E> order) {
            this(type, id, loader, order, new HashMap<>(), new HashMap<>());
        }

        EntityAccess<E> withKey(String name, Function<E, Long> key, Function<Collection<Long>, List<E>> finder) {
            keys.put(name, key);
            finders.put(name, finder);
            return this;
        }

        Function<E, Long> key(String name) {
            Function<E, Long> key = keys.get(name);
            if (key == null) {
                throw new IllegalArgumentException(type.getSimpleName() + " has no foreign key '" + name + "'");
            }
            return key;
        }

        Function<Collection<Long>, List<E>> finder(String name) {
            key(name);
            return finders.get(name);
        }
    }
}
