package gov.nih.ncats.objdetect.cascade;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reflects a cascade about the vertical center line of its window, so a
 * classifier trained on one orientation (a left hand, a profile face) also
 * finds the mirrored object.
 */
public final class CascadeMirror {

    private CascadeMirror(){
        //can not instantiate
    }

    /**
     * Create the horizontally mirrored version of a cascade.
     * Upright rectangles move to {@code windowWidth - x - width}. For tilted rectangles the
     * top corner moves to {@code windowWidth - x} and width and height trade places, since
     * reflecting turns the down-right edge into a down-left edge.
     *
     * @param cascade the cascade to mirror; can not be null.
     * @return a new Cascade; mirroring it again gives back an equal cascade.
     */
    public static Cascade mirror(Cascade cascade){
        Objects.requireNonNull(cascade, "cascade can not be null");
        int windowWidth = cascade.getWindowWidth();

        List<Stage> stages = new ArrayList<>(cascade.getStages().size());
        for(Stage stage : cascade.getStages()){
            List<Tree> trees = new ArrayList<>(stage.getTrees().size());
            for(Tree tree : stage.getTrees()){
                List<Feature> features = new ArrayList<>(tree.getFeatures().size());
                for(Feature f : tree.getFeatures()){
                    if(tree.isTilted()){
                        features.add(new Feature(windowWidth - f.getX(), f.getY(), f.getHeight(), f.getWidth(), f.getWeight()));
                    }else{
                        features.add(new Feature(windowWidth - f.getX() - f.getWidth(), f.getY(), f.getWidth(), f.getHeight(), f.getWeight()));
                    }
                }
                trees.add(new Tree(tree.isTilted(), features, tree.getThreshold(), tree.getLeftValue(), tree.getRightValue()));
            }
            stages.add(new Stage(stage.getThreshold(), trees));
        }
        return new Cascade(windowWidth, cascade.getWindowHeight(), stages);
    }
}
