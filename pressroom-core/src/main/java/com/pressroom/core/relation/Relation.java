package com.pressroom.core.relation;

import com.pressroom.core.domain.Account;
import com.pressroom.core.domain.Content;
import com.pressroom.core.domain.ContentTag;
import com.pressroom.core.domain.Profile;
import com.pressroom.core.domain.Tag;

import java.util.List;

/**
 * Declaration of one navigable relation between two entity types.
 * 
 * A relation names the entity that owns the foreign key, the foreign-key attribute,
 * its cardinality and, for many-to-many relations, the join entity together with
 * the join keys pointing at the source and the target.
 *
 * @param <S> source entity type
 * @param <T> target entity type
 */
public final class Relation<S, T> {

    public static final Relation<Account, Profile> ACCOUNT_PROFILE = new Relation<>(
            "account.profile", Account.class, Profile.class, Profile.class,
            "accountId", Cardinality.ONE_TO_ONE, null, null, null);

    public static final Relation<Profile, Account> PROFILE_ACCOUNT = new Relation<>(
            "profile.account", Profile.class, Account.class, Profile.class,
            "accountId", Cardinality.ONE_TO_ONE, null, null, null);

    public static final Relation<Account, Content> ACCOUNT_CONTENTS = new Relation<>(
            "account.contents", Account.class, Content.class, Content.class,
            "accountId", Cardinality.ONE_TO_MANY, null, null, null);

    public static final Relation<Content, Account> CONTENT_ACCOUNT = new Relation<>(
            "content.account", Content.class, Account.class, Content.class,
            "accountId", Cardinality.MANY_TO_ONE, null, null, null);

    public static final Relation<Content, Tag> CONTENT_TAGS = new Relation<>(
            "content.tags", Content.class, Tag.class, ContentTag.class,
            null, Cardinality.MANY_TO_MANY, ContentTag.class, "contentId", "tagId");

    public static final Relation<Tag, Content> TAG_CONTENTS = new Relation<>(
            "tag.contents", Tag.class, Content.class, ContentTag.class,
            null, Cardinality.MANY_TO_MANY, ContentTag.class, "tagId", "contentId");

    private final String name;
    private final Class<S> sourceType;
    private final Class<T> targetType;
    private final Class<?> owningType;
    private final String foreignKey;
    private final Cardinality cardinality;
    private final Class<?> joinType;
    private final String joinSourceKey;
    private final String joinTargetKey;

    private Relation(String name, Class<S> sourceType, Class<T> targetType, Class<?> owningType,
                     String foreignKey, Cardinality cardinality,
                     Class<?> joinType, String joinSourceKey, String joinTargetKey) {
        this.name = name;
        this.sourceType = sourceType;
        this.targetType = targetType;
        this.owningType = owningType;
        this.foreignKey = foreignKey;
        this.cardinality = cardinality;
        this.joinType = joinType;
        this.joinSourceKey = joinSourceKey;
        this.joinTargetKey = joinTargetKey;
    }

    /**
     * All declared relations.
     */
    public static List<Relation<?, ?>> all() {
        return List.of(ACCOUNT_PROFILE, PROFILE_ACCOUNT, ACCOUNT_CONTENTS,
                CONTENT_ACCOUNT, CONTENT_TAGS, TAG_CONTENTS);
    }

    /**
     * True when the source entity holds the foreign key itself.
     */
    public boolean isOwnedBySource() {
        return owningType.equals(sourceType);
    }

    public boolean isJoined() {
        return joinType != null;
    }

    public String getName() { return name; }
    public Class<S> getSourceType() { return sourceType; }
    public Class<T> getTargetType() { return targetType; }
    public Class<?> getOwningType() { return owningType; }
    public String getForeignKey() { return foreignKey; }
    public Cardinality getCardinality() { return cardinality; }
    public Class<?> getJoinType() { return joinType; }
    public String getJoinSourceKey() { return joinSourceKey; }
    public String getJoinTargetKey() { return joinTargetKey; }

    @Override
    public String toString() {
        return name;
    }
}
