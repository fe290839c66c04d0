package com.worldgen.model;

import com.worldgen.model.scalar.AdjacencyRuleName;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseRecord;
import com.worldgen.parser.ClauseSchema;
import com.worldgen.parser.ClauseValue;

import java.util.List;
import java.util.Optional;

/**
 * A named rule restricting movement across a strait or canal, one
 * {@code adjacency_rule = { ... }} block of the adjacency rules file.
 *
 * @param name              referenced from the rule name column of the adjacencies file
 * @param contested         crossing rights while the controlling provinces are contested
 * @param enemy             crossing rights for enemies of the controller
 * @param friend            crossing rights for friends of the controller
 * @param neutral           crossing rights for neutral countries
 * @param requiredProvinces provinces whose controller decides the relation
 * @param icon              province the rule icon is drawn on
 * @param offset            icon offset from the province centre
 * @param disabledTooltip   tooltip of the optional {@code is_disabled} trigger
 */
public record AdjacencyRule(
        AdjacencyRuleName name,
        AdjacencyLogic contested,
        AdjacencyLogic enemy,
        AdjacencyLogic friend,
        AdjacencyLogic neutral,
        List<ProvinceId> requiredProvinces,
        ProvinceId icon,
        Offset offset,
        Optional<String> disabledTooltip
) {

    static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .required("name", "contested", "enemy", "friend", "neutral", "required_provinces", "icon", "offset")
            .optional("is_disabled")
            .build();

    private static final ClauseSchema DISABLED_SCHEMA = ClauseSchema.builder()
            .optional("tooltip")
            .build();

    public AdjacencyRule {
        requiredProvinces = List.copyOf(requiredProvinces);
    }

    public static AdjacencyRule fromClause(ClauseValue value) {
        ClauseRecord record = value.asBlock().decode(SCHEMA);
        return new AdjacencyRule(
                record.get("name", AdjacencyRuleName::fromClause),
                record.get("contested", AdjacencyLogic::fromClause),
                record.get("enemy", AdjacencyLogic::fromClause),
                record.get("friend", AdjacencyLogic::fromClause),
                record.get("neutral", AdjacencyLogic::fromClause),
                record.getList("required_provinces", ProvinceId::fromClause),
                record.get("icon", ProvinceId::fromClause),
                record.get("offset", Offset::fromClause),
                record.find("is_disabled", AdjacencyRule::tooltip).flatMap(t -> t));
    }

    private static Optional<String> tooltip(ClauseValue value) {
        return value.asBlock().decode(DISABLED_SCHEMA).find("tooltip", v -> v.asScalar().text());
    }

    public ClauseBlock toClause() {
        ClauseBlock.Builder builder = ClauseBlock.builder()
                .field("name", name.toClause())
                .field("contested", contested.toClause())
                .field("enemy", enemy.toClause())
                .field("friend", friend.toClause())
                .field("neutral", neutral.toClause())
                .field("required_provinces", ClauseBlock.ofItems(requiredProvinces, ProvinceId::toClause))
                .field("icon", icon.toClause())
                .field("offset", offset.toClause());
        disabledTooltip.ifPresent(tooltip ->
                builder.field("is_disabled", ClauseBlock.builder().quoted("tooltip", tooltip).build()));
        return builder.build();
    }
}
