/**
 * Nested set tree maintenance over a relational table.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   NestedSetRepository     ← single entry point, one transaction per call
 *        │
 *        ├── PendingActionQueue  ← one buffered intent per node instance
 *        │        │
 *        │        ▼
 *        ├── TreeMutator         ← root / append / prepend / before / after / delete
 *        │        │
 *        │        ▼
 *        │   GapAllocator        ← open / close ranges of bound values
 *        │        │
 *        ├── TreeQuery           ← read-only bound comparisons
 *        │        │
 *        ▼        ▼
 *   BoundsStore             ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴───┐
 *    │       │
 *  SqlStore  InMemoryStore
 * </pre>
 *
 * <h2>Encoding</h2>
 * Every node owns two integers, {@code lft < rgt}. A node's descendants are
 * exactly the rows whose {@code lft} lies strictly between its own bounds, so
 * subtree, ancestor and ordering queries are single range scans. After every
 * committed mutation each integer in {@code [1, max(rgt)]} is used by exactly
 * one bound, and any two intervals are either disjoint or properly nested.
 *
 * <pre>
 *   R [1,6]
 *   ├── X [2,3]
 *   └── Y [4,5]
 * </pre>
 *
 * <h2>Table</h2>
 *
 * <pre>
 * ┌──────────────────┬────────────────────────────────────────────────┐
 * │ id  (PK)         │ row id                                         │
 * │ name             │ payload                                        │
 * │ parent_id        │ id of the parent row, NULL for roots           │
 * │ lft              │ left bound                                     │
 * │ rgt              │ right bound                                    │
 * │ deleted_at       │ soft-delete marker (epoch seconds) or NULL     │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>SQL File Inventory</h2>
 * All statements are externalized to {@code sql/*.sql} and loaded via
 * {@link de.bsommerfeld.nestedset.db.SqlLoader}; {@code {table}} stands for
 * the configured table name.
 * <ul>
 * <li>{@code max-rgt.sql}, {@code select-bounds.sql}: maintenance reads</li>
 * <li>{@code shift-lft.sql}, {@code shift-rgt.sql}: open or close a gap</li>
 * <li>{@code move-subtree.sql}: relocate a subtree in one statement</li>
 * <li>{@code delete-range.sql}: remove a subtree</li>
 * <li>{@code insert-node.sql}, {@code update-node.sql}, {@code update-parent.sql},
 * {@code mark-deleted.sql}: row writes</li>
 * <li>{@code select-*.sql}: one file per query predicate</li>
 * <li>{@code count-*.sql}: consistency diagnostics</li>
 * </ul>
 */
package de.bsommerfeld.nestedset.db;
