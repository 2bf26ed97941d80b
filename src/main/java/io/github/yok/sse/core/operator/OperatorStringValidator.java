package io.github.yok.sse.core.operator;

import io.github.yok.sse.core.model.IsingModel;
import io.github.yok.sse.core.operator.InvalidBondStateException.Kind;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/**
 * 境界状態から演算子列全体を伝播し直し、ボンド演算子の符号規則を検証するクラスです。
 *
 * <p>
 * 診断用であり、通常のスイープでは呼びません。
 * </p>
 */
public final class OperatorStringValidator {

    /**
     * 違反を 1 件見つけた時点で例外を送出します。
     *
     * @param model 横磁場イジング模型です
     * @param operators 演算子列です
     * @param boundary 左端の境界状態です
     * @throws InvalidBondStateException 符号規則違反がある場合に発生します
     */
    public void validate(IsingModel model, OperatorString operators, boolean[] boundary) {
        List<Violation> violations = inspect(model, operators, boundary, true);
        if (!violations.isEmpty()) {
            Violation v = violations.get(0);
            throw new InvalidBondStateException(v.getKind(), v.getSlot(), v.getFirstSite(),
                    v.getSecondSite());
        }
    }

    /**
     * 全ての違反を列挙します（例外は送出しません）。
     *
     * @param model 横磁場イジング模型です
     * @param operators 演算子列です
     * @param boundary 左端の境界状態です
     * @return 違反の一覧です（違反がなければ空）
     */
    public List<Violation> findViolations(IsingModel model, OperatorString operators,
            boolean[] boundary) {
        return inspect(model, operators, boundary, false);
    }

    private static List<Violation> inspect(IsingModel model, OperatorString operators,
            boolean[] boundary, boolean stopAtFirst) {
        if (model == null || operators == null || boundary == null) {
            throw new IllegalArgumentException("model/operators/boundary は null 不可です");
        }
        if (boundary.length != model.siteCount()) {
            throw new IllegalArgumentException("境界状態の長さがサイト数と一致しません: " + boundary.length
                    + " vs " + model.siteCount());
        }

        List<Violation> violations = new ArrayList<>();
        boolean[] alpha = boundary.clone();

        for (int p = 0; p < operators.length(); p++) {
            OperatorType type = operators.typeAt(p);
            if (type == OperatorType.OFF_DIAGONAL_FIELD) {
                int s = operators.firstSite(p);
                alpha[s] = !alpha[s];
                continue;
            }
            if (type != OperatorType.BOND) {
                continue;
            }

            int i = operators.firstSite(p);
            int j = operators.secondSite(p);
            Kind kind = violationOf(model.coupling(i, j), alpha[i], alpha[j]);
            if (kind != null) {
                violations.add(new Violation(kind, p, i, j));
                if (stopAtFirst) {
                    break;
                }
            }
        }
        return violations;
    }

    /**
     * ボンドの符号規則に対する違反の種類を返します。
     *
     * @param coupling 結合 J_ij です
     * @param spinI サイト i のスピンです
     * @param spinJ サイト j のスピンです
     * @return 違反の種類です（違反がなければ null）
     */
    private static Kind violationOf(double coupling, boolean spinI, boolean spinJ) {
        if (coupling == 0.0) {
            return Kind.BOND_ON_ZERO_COUPLING;
        }
        if (coupling > 0.0 && spinI == spinJ) {
            return Kind.ANTIFERROMAGNETIC_BOND_ON_ALIGNED_SPINS;
        }
        if (coupling < 0.0 && spinI != spinJ) {
            return Kind.FERROMAGNETIC_BOND_ON_MISALIGNED_SPINS;
        }
        return null;
    }

    /**
     * 検出した違反 1 件です。
     */
    @Value
    public static class Violation {

        /**
         * 違反の種類です。
         */
        Kind kind;

        /**
         * スロットです。
         */
        int slot;

        /**
         * ボンドの 1 番目のサイトです。
         */
        int firstSite;

        /**
         * ボンドの 2 番目のサイトです。
         */
        int secondSite;
    }
}
