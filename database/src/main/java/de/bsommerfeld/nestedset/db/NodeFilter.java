package de.bsommerfeld.nestedset.db;

import de.bsommerfeld.nestedset.core.domain.NodeBounds;
import de.bsommerfeld.nestedset.core.domain.TreeNode;

import java.util.Objects;

/**
 * A row predicate expressed purely as comparisons on {@code lft},
 * {@code rgt} and {@code parent_id}. Each kind maps to one statement file for
 * {@link SqlBoundsStore} and to {@link #matches} for
 * {@link InMemoryBoundsStore}, so both stores agree on the semantics.
 *
 * @param kind      which predicate
 * @param lft       reference left bound, where the kind uses one
 * @param rgt       reference right bound, where the kind uses one
 * @param parentId  reference parent, compared null-safe
 * @param excludeId row excluded from sibling queries
 */
public record NodeFilter(Kind kind, int lft, int rgt, Long parentId, Long excludeId) {

    public enum Kind {
        ALL("select-all"),
        /** {@code lft > ref.lft AND lft < ref.rgt} */
        DESCENDANTS("select-descendants"),
        /** {@code lft < ref.lft AND rgt > ref.rgt} */
        ANCESTORS("select-ancestors"),
        /** {@code lft > ref.rgt} */
        AFTER("select-after"),
        /** {@code rgt < ref.lft} */
        BEFORE("select-before"),
        /** {@code parent_id IS ref.parentId} */
        CHILDREN("select-children"),
        SIBLINGS("select-siblings"),
        NEXT_SIBLINGS("select-next-siblings"),
        PREV_SIBLINGS("select-prev-siblings");

        private final String statement;

        Kind(String statement) {
            this.statement = statement;
        }

        public String statement() {
            return statement;
        }
    }

    public static NodeFilter all() {
        return new NodeFilter(Kind.ALL, 0, 0, null, null);
    }

    public static NodeFilter descendantsOf(NodeBounds ref) {
        return new NodeFilter(Kind.DESCENDANTS, ref.lft(), ref.rgt(), null, null);
    }

    public static NodeFilter ancestorsOf(NodeBounds ref) {
        return new NodeFilter(Kind.ANCESTORS, ref.lft(), ref.rgt(), null, null);
    }

    public static NodeFilter after(NodeBounds ref) {
        return new NodeFilter(Kind.AFTER, ref.lft(), ref.rgt(), null, null);
    }

    public static NodeFilter before(NodeBounds ref) {
        return new NodeFilter(Kind.BEFORE, ref.lft(), ref.rgt(), null, null);
    }

    /** Children of {@code parentId}; roots when it is {@code null}. */
    public static NodeFilter childrenOf(Long parentId) {
        return new NodeFilter(Kind.CHILDREN, 0, 0, parentId, null);
    }

    public static NodeFilter siblingsOf(long id, NodeBounds ref) {
        return new NodeFilter(Kind.SIBLINGS, ref.lft(), ref.rgt(), ref.parentId(), id);
    }

    public static NodeFilter nextSiblingsOf(NodeBounds ref) {
        return new NodeFilter(Kind.NEXT_SIBLINGS, ref.lft(), ref.rgt(), ref.parentId(), null);
    }

    public static NodeFilter prevSiblingsOf(NodeBounds ref) {
        return new NodeFilter(Kind.PREV_SIBLINGS, ref.lft(), ref.rgt(), ref.parentId(), null);
    }

    public boolean matches(TreeNode node) {
        switch (kind) {
            case ALL:
                return true;
            case DESCENDANTS:
                return node.getLft() > lft && node.getLft() < rgt;
            case ANCESTORS:
                return node.getLft() < lft && node.getRgt() > rgt;
            case AFTER:
                return node.getLft() > rgt;
            case BEFORE:
                return node.getRgt() < lft;
            case CHILDREN:
                return Objects.equals(node.getParentId(), parentId);
            case SIBLINGS:
                return Objects.equals(node.getParentId(), parentId) && !Objects.equals(node.getId(), excludeId);
            case NEXT_SIBLINGS:
                return Objects.equals(node.getParentId(), parentId) && node.getLft() > rgt;
            case PREV_SIBLINGS:
                return Objects.equals(node.getParentId(), parentId) && node.getRgt() < lft;
            default:
                throw new IllegalStateException("Unhandled filter kind " + kind);
        }
    }
}
