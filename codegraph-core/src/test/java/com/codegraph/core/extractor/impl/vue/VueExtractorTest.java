package com.codegraph.core.extractor.impl.vue;

import com.codegraph.core.extractor.ExtractionResult;
import com.codegraph.core.extractor.Extractor;
import com.codegraph.core.extractor.ExtractorTestBase;
import com.codegraph.core.extractor.RawEntity;
import com.codegraph.core.model.Language;
import com.codegraph.core.model.ParseErrorKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Functional tests for {@link VueExtractor}.
 *
 * <p>Tests cover:
 * <ul>
 *   <li>Options API components: name, props, data, methods, lifecycle hooks</li>
 *   <li>Composition API with script setup</li>
 *   <li>Template component usage, event handlers and interpolation calls</li>
 *   <li>Missing closing tags</li>
 * </ul>
 */
class VueExtractorTest extends ExtractorTestBase {

    private static final String USER_CARD = """
        <template>
          <div class="card">
            <user-avatar :src="user.avatar" />
            <BaseButton @click="save">{{ formatName(user) }}</BaseButton>
          </div>
        </template>

        <script>
        import UserAvatar from './UserAvatar.vue';
        import BaseButton from '@/components/BaseButton.vue';
        import { formatName } from '@/util/format';

        export default {
          name: 'user-card',
          components: { UserAvatar, BaseButton },
          props: ['user'],
          data() {
            return { saving: false };
          },
          methods: {
            save() {
              this.persist(this.user);
            },
            formatName,
          },
          mounted() {
            this.load();
          },
        };
        </script>
        """;

    private static final String COMPONENT = "src.components.UserCard.UserCard";

    private final VueExtractor extractor = new VueExtractor();

    @Override
    protected Extractor extractor() {
        return extractor;
    }

    @Test
    void parse_withOptionsApi_extractsComponentMembers() {
        // When: An Options API component is parsed
        ExtractionResult result = parse("src/components/UserCard.vue", USER_CARD);

        // Then: The component is named after its name option and owns its members
        assertThat(result.errors()).isEmpty();
        assertThat(result.language()).isEqualTo(Language.VUE);

        RawEntity component = entity(result, COMPONENT);
        assertThat(component.kind()).isEqualTo("vue_component");
        assertThat(component.metadata()).containsEntry("framework", "vue");

        assertThat(entity(result, COMPONENT + ".user").kind()).isEqualTo("prop");
        assertThat(entity(result, COMPONENT + ".saving").kind()).isEqualTo("data");
        RawEntity save = entity(result, COMPONENT + ".save");
        assertThat(save.kind()).isEqualTo("method");
        assertThat(save.parentLocalId()).isEqualTo(component.localId());
        assertThat(entity(result, COMPONENT + ".mounted").metadata()).containsEntry("lifecycle", true);

        assertThat(targets(result, COMPONENT + ".save", "calls")).containsExactly(COMPONENT + ".persist");
        assertThat(targets(result, COMPONENT + ".mounted", "calls")).containsExactly(COMPONENT + ".load");
    }

    @Test
    void parse_withRegisteredComponents_reportsReferencesAndTemplateUsage() {
        // When: A component registering and rendering children is parsed
        ExtractionResult result = parse("src/components/UserCard.vue", USER_CARD);

        // Then: Registrations, kebab-case tags and template calls resolve through the imports
        assertThat(targets(result, COMPONENT, "references")).containsExactly(
            "src.components.UserAvatar.UserAvatar", "src.components.BaseButton.BaseButton");
        assertThat(targets(result, COMPONENT, "template_usage")).containsExactly(
            "src.components.UserAvatar.UserAvatar", "src.components.BaseButton.BaseButton");
        assertThat(targets(result, COMPONENT, "calls"))
            .containsExactly(COMPONENT + ".save", "src.util.format.formatName");
        assertThat(targets(result, "src.components.UserCard", "imports")).containsExactly(
            "src.components.UserAvatar.UserAvatar",
            "src.components.BaseButton.BaseButton",
            "src.util.format.formatName");
    }

    @Test
    void parse_withScriptSetup_extractsCompositionState() {
        // Given: A script setup component using refs, computed values and props
        String source = """
            <script setup lang="ts">
            import { ref, computed } from 'vue';
            import TodoItem from './TodoItem.vue';

            const props = defineProps<{ title: string; limit: number }>();
            const items = ref<string[]>([]);
            const count = computed(() => items.value.length);

            function add(text: string) {
              items.value.push(text);
            }
            </script>

            <template>
              <TodoItem v-for="item in items" :key="item" @remove="add" />
            </template>
            """;

        // When: File is parsed
        ExtractionResult result = parse("src/TodoList.vue", source);

        // Then: The component is named after the file and owns its state
        String component = "src.TodoList.TodoList";
        assertThat(entity(result, component).metadata())
            .containsEntry("scriptSetup", true)
            .containsEntry("scriptLang", "ts");
        assertThat(entity(result, component + ".items").kind()).isEqualTo("ref");
        assertThat(entity(result, component + ".count").kind()).isEqualTo("computed");
        assertThat(entity(result, component + ".title").kind()).isEqualTo("prop");
        assertThat(entity(result, component + ".add").kind()).isEqualTo("function");

        assertThat(targets(result, component, "calls")).contains("vue.ref", "vue.computed", component + ".add");
        assertThat(targets(result, component, "template_usage")).containsExactly("src.TodoItem.TodoItem");
    }

    @Test
    void parse_withUnclosedScript_reportsSyntaxError() {
        // Given: A script block without its closing tag
        String source = "<script>\nexport default {}\n";

        // When: File is parsed
        ExtractionResult result = parse("Broken.vue", source);

        // Then: The missing tag is reported and the component still exists
        assertThat(hasError(result, ParseErrorKind.SYNTAX, "Missing closing </script> tag")).isTrue();
        assertThat(findEntity(result, "Broken.Broken")).isPresent();
    }

    @Test
    void pascalCase_convertsKebabAndSnakeCase() {
        assertThat(VueExtractor.pascalCase("user-card")).isEqualTo("UserCard");
        assertThat(VueExtractor.pascalCase("my_widget")).isEqualTo("MyWidget");
        assertThat(VueExtractor.pascalCase("BaseButton")).isEqualTo("BaseButton");
    }
}
